package com.tony.cardLeague.exception;

public class LeagueAlreadyScheduledException extends LeagueException {

    public LeagueAlreadyScheduledException(Long lobbyId) {
        super("League already exists for lobby " + lobbyId);
    }
}
