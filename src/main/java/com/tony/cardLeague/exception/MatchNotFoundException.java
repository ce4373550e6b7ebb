package com.tony.cardLeague.exception;

public class MatchNotFoundException extends LeagueException {

    public MatchNotFoundException(Long matchId) {
        super("Match not found: " + matchId);
    }
}
