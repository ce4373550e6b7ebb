package com.tony.cardLeague.exception;

/**
 * Match déjà simulé. Bénin dans les traitements par lot.
 */
public class MatchAlreadyPlayedException extends LeagueException {

    public MatchAlreadyPlayedException(Long matchId) {
        super("Match has already been played: " + matchId);
    }
}
