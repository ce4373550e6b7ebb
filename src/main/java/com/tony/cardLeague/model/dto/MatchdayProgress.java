package com.tony.cardLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class MatchdayProgress {
    private int matchDay;
    private long totalMatches;
    private long playedMatches;

    public boolean isComplete() {
        return totalMatches > 0 && playedMatches == totalMatches;
    }
}
