package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.exception.ScheduleAlreadyExistsException;
import com.tony.cardLeague.model.LeagueMatch;
import com.tony.cardLeague.model.Lobby;
import com.tony.cardLeague.model.Team;
import com.tony.cardLeague.repository.LeagueMatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    private final LeagueMatchRepository matchRepository;
    private final LeagueProperties properties;

    /**
     * Crée les 6 matchs (non joués) d'une journée à partir des 4 équipes alignées.
     */
    @Transactional
    public List<LeagueMatch> generateMatchday(Lobby lobby, int matchDay, List<Team> teams) {
        if (teams.size() != properties.getLobbyCapacity()) {
            throw new IllegalArgumentException(String.format("Matchday %d needs exactly %d teams, got %d",
                    matchDay, properties.getLobbyCapacity(), teams.size()));
        }
        if (matchRepository.existsByLobbyIdAndMatchDay(lobby.getId(), matchDay)) {
            throw new ScheduleAlreadyExistsException(lobby.getId(), matchDay);
        }

        List<LeagueMatch> matches = roundRobin(teams).stream()
                .map(p -> new LeagueMatch(lobby, p.home(), p.away(), matchDay))
                .toList();

        List<LeagueMatch> saved = matchRepository.saveAll(matches);
        log.info("📅 Journée {} du lobby {} : {} matchs générés", matchDay, lobby.getId(), saved.size());
        return saved;
    }

    /**
     * Toutes les paires non ordonnées (i < j) dans l'ordre des index : T1T2, T1T3, T1T4, T2T3, T2T4, T3T4.
     * Le premier élément de la paire reçoit.
     */
    public static <T> List<Pairing<T>> roundRobin(List<T> teams) {
        List<Pairing<T>> pairings = new ArrayList<>();
        for (int i = 0; i < teams.size(); i++) {
            for (int j = i + 1; j < teams.size(); j++) {
                pairings.add(new Pairing<>(teams.get(i), teams.get(j)));
            }
        }
        return pairings;
    }

    public record Pairing<T>(T home, T away) {}
}
