package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.model.MatchSide;
import com.tony.cardLeague.model.dto.MatchSimulation;
import com.tony.cardLeague.model.dto.SimulatedGoal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

@Service
@RequiredArgsConstructor
public class MatchSimulationService {

    private final LeagueProperties properties;
    private final Random matchRandom;

    public MatchSimulation simulate(int homeStrength, int awayStrength) {
        return simulate(homeStrength, awayStrength, List.of(), List.of());
    }

    /**
     * Moteur de match par occasions.
     * Chaque équipe a N occasions indépendantes (100 par défaut). La probabilité de conversion
     * d'une occasion est la part de force de l'équipe : pHome = sH / (sH + sA). Si les deux forces
     * sont nulles, 50/50. Chaque but reçoit une minute aléatoire (1..90) et le journal est trié par minute.
     * Deux appels identiques donnent deux résultats différents : l'appelant persiste le résultat une seule fois.
     *
     * @param homeScorers ids des joueurs alignés à domicile (buteurs possibles), peut être vide
     * @param awayScorers ids des joueurs alignés à l'extérieur, peut être vide
     */
    public MatchSimulation simulate(int homeStrength, int awayStrength, List<Long> homeScorers, List<Long> awayScorers) {
        if (homeStrength < 0 || awayStrength < 0) {
            throw new IllegalArgumentException("Strength must be >= 0 (home=" + homeStrength + ", away=" + awayStrength + ")");
        }

        double total = (double) homeStrength + awayStrength;
        double pHome = total == 0 ? 0.5 : homeStrength / total;
        double pAway = total == 0 ? 0.5 : awayStrength / total;

        int chances = properties.getChancesPerTeam();
        List<SimulatedGoal> events = new ArrayList<>();

        int homeGoals = playChances(MatchSide.HOME, pHome, chances, homeScorers, events);
        int awayGoals = playChances(MatchSide.AWAY, pAway, chances, awayScorers, events);

        // Tri stable : à minute égale, l'ordre des essais est conservé (domicile d'abord)
        events.sort(Comparator.comparingInt(SimulatedGoal::getMinute));

        return MatchSimulation.builder()
                .homeScore(homeGoals)
                .awayScore(awayGoals)
                .homeConversionProbability(pHome)
                .awayConversionProbability(pAway)
                .homeChances(chances)
                .awayChances(chances)
                .events(events)
                .build();
    }

    private int playChances(MatchSide side, double probability, int chances, List<Long> scorers, List<SimulatedGoal> events) {
        int goals = 0;
        for (int i = 0; i < chances; i++) {
            if (matchRandom.nextDouble() >= probability) continue;

            goals++;
            int minute = 1 + matchRandom.nextInt(properties.getMaxMinute());
            Long scorer = scorers.isEmpty() ? null : scorers.get(matchRandom.nextInt(scorers.size()));
            events.add(new SimulatedGoal(minute, side, scorer));
        }
        return goals;
    }
}
