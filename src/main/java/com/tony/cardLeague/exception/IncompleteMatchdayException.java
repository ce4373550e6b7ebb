package com.tony.cardLeague.exception;

/**
 * Levée quand une journée n'a pas exactement une équipe par membre du lobby.
 */
public class IncompleteMatchdayException extends LeagueException {

    public IncompleteMatchdayException(Long lobbyId, int matchDay, int expected, int found) {
        super(String.format("Matchday %d of lobby %d needs exactly %d teams, found %d",
                matchDay, lobbyId, expected, found));
    }

    public IncompleteMatchdayException(Long lobbyId, int matchDay, String reason) {
        super(String.format("Matchday %d of lobby %d is invalid: %s", matchDay, lobbyId, reason));
    }
}
