package com.tony.cardLeague.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ligne du classement. Jamais persistée : toujours recalculée depuis les matchs joués.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeagueTableEntry {
    private Long userId;
    private Integer rank;

    private int points;
    private int matchesPlayed;
    private int wins;   // V
    private int draws;  // N
    private int losses; // D
    private int goalsFor;
    private int goalsAgainst;
    private int goalDifference;
}
