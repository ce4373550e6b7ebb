package com.tony.cardLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchSimulationResult {
    private Long matchId;
    private Integer matchDay;

    private Long homeTeamId;
    private Long awayTeamId;

    private int homeScore;
    private int awayScore;

    private int homeStrength;
    private int awayStrength;
    private double homeConversionProbability;
    private double awayConversionProbability;

    @Builder.Default
    private List<SimulatedGoal> events = new ArrayList<>();

    private boolean leagueComplete;

    public String getScore() {
        return homeScore + "-" + awayScore;
    }
}
