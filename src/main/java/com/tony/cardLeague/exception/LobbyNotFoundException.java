package com.tony.cardLeague.exception;

public class LobbyNotFoundException extends LeagueException {

    public LobbyNotFoundException(Long lobbyId) {
        super("Lobby not found: " + lobbyId);
    }
}
