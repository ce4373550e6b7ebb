package com.tony.cardLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Résultat brut d'une simulation : scores, probabilités de conversion et journal des buts trié par minute.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchSimulation {
    private int homeScore;
    private int awayScore;

    private double homeConversionProbability;
    private double awayConversionProbability;

    private int homeChances;
    private int awayChances;

    @Builder.Default
    private List<SimulatedGoal> events = new ArrayList<>();
}
