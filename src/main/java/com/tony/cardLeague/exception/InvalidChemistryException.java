package com.tony.cardLeague.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidChemistryException extends LeagueException {

    private final List<String> violations;

    public InvalidChemistryException(Long teamId, List<String> violations) {
        super("Team " + teamId + " breaks the chemistry rules: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
