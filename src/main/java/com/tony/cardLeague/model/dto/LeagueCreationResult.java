package com.tony.cardLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

@Data
@AllArgsConstructor
public class LeagueCreationResult {
    private Long lobbyId;
    private int totalMatches;
    private Map<Integer, Integer> perMatchdayCounts; // journée -> nombre de matchs
}
