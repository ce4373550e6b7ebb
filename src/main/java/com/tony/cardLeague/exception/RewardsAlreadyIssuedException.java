package com.tony.cardLeague.exception;

public class RewardsAlreadyIssuedException extends LeagueException {

    public RewardsAlreadyIssuedException(Long lobbyId) {
        super("Rewards already issued for lobby " + lobbyId);
    }
}
