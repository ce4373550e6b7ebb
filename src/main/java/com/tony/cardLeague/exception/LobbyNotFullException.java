package com.tony.cardLeague.exception;

public class LobbyNotFullException extends LeagueException {

    public LobbyNotFullException(Long lobbyId, int members, int capacity) {
        super(String.format("Lobby %d must have exactly %d players to create a league (found %d)",
                lobbyId, capacity, members));
    }
}
