package com.tony.cardLeague.exception;

public class ScheduleAlreadyExistsException extends LeagueException {

    public ScheduleAlreadyExistsException(Long lobbyId, int matchDay) {
        super(String.format("Matches already exist for lobby %d, matchday %d", lobbyId, matchDay));
    }
}
