package com.tony.cardLeague.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "league")
@Data
public class LeagueProperties {
    // --- Format de la ligue ---
    private int lobbyCapacity = 4;
    private int matchDays = 3;
    private int playersPerTeam = 11;

    // --- Règles de chimie ---
    private int requiredColors = 3;
    private int minPlayersPerColor = 2;

    // --- Moteur de match ---
    private int chancesPerTeam = 100;
    private int maxMinute = 90;

    // --- Récompenses (position -> pièces) ---
    private Map<Integer, Integer> rewards = new LinkedHashMap<>(Map.of(
            1, 250,
            2, 200,
            3, 150,
            4, 100
    ));

    private Autoplay autoplay = new Autoplay();

    /**
     * Nombre de matchs par journée pour un tournoi toutes rondes (n*(n-1)/2).
     */
    public int getMatchesPerMatchDay() {
        return lobbyCapacity * (lobbyCapacity - 1) / 2;
    }

    public int getTotalMatches() {
        return getMatchesPerMatchDay() * matchDays;
    }

    @Data
    public static class Autoplay {
        private boolean enabled = false;
        private String cron = "0 */15 * * * *";
    }
}
