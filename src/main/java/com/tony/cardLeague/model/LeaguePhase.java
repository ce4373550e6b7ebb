package com.tony.cardLeague.model;

/**
 * Phase de la ligue d'un lobby, déduite de l'état des matchs et des récompenses.
 */
public enum LeaguePhase {
    NO_LEAGUE,
    SCHEDULED,
    COMPLETE,
    REWARDED
}
