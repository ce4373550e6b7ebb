package com.tony.cardLeague.exception;

/**
 * Exception de base du moteur de ligue. Toutes sont récupérables par l'appelant.
 */
public class LeagueException extends RuntimeException {

    public LeagueException(String message) {
        super(message);
    }

    public LeagueException(String message, Throwable cause) {
        super(message, cause);
    }
}
