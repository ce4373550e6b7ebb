package com.tony.cardLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class LeagueSimulationResult {
    private Long lobbyId;
    private List<MatchSimulationResult> results; // Ordre (journée, id du match)
    private boolean leagueComplete;
}
