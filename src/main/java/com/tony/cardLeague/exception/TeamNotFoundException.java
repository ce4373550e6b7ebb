package com.tony.cardLeague.exception;

public class TeamNotFoundException extends LeagueException {

    public TeamNotFoundException(Long teamId) {
        super("Team not found: " + teamId);
    }
}
