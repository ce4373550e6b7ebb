package com.tony.cardLeague.exception;

public class IncompleteTeamException extends LeagueException {

    public IncompleteTeamException(Long teamId, int filled, int required) {
        super(String.format("Team %d has %d/%d players, fix your roster", teamId, filled, required));
    }
}
