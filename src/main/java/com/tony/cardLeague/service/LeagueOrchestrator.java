package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.exception.*;
import com.tony.cardLeague.model.*;
import com.tony.cardLeague.model.dto.*;
import com.tony.cardLeague.repository.LeagueMatchRepository;
import com.tony.cardLeague.repository.LobbyRepository;
import com.tony.cardLeague.repository.RewardRepository;
import com.tony.cardLeague.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cycle de vie d'une ligue : NO_LEAGUE -> SCHEDULED(journée k) -> COMPLETE -> REWARDED.
 * Seul composant qui touche aux lobbies, équipes, matchs et récompenses persistés.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeagueOrchestrator {

    private final LobbyRepository lobbyRepository;
    private final TeamRepository teamRepository;
    private final LeagueMatchRepository matchRepository;
    private final RewardRepository rewardRepository;
    private final ScheduleService scheduleService;
    private final LeagueTableService tableService;
    private final MatchPlayService matchPlayService;
    private final LeagueProperties properties;

    /**
     * Génère les 3 journées d'un coup (tout ou rien) : les 4 équipes de chaque journée sont déjà fixées.
     */
    @Transactional
    public LeagueCreationResult createLeague(Long lobbyId) {
        Lobby lobby = findLobby(lobbyId);

        int members = lobby.getMembers().size();
        if (members != properties.getLobbyCapacity()) {
            throw new LobbyNotFullException(lobbyId, members, properties.getLobbyCapacity());
        }
        if (matchRepository.existsByLobbyId(lobbyId)) {
            throw new LeagueAlreadyScheduledException(lobbyId);
        }

        Set<Long> memberIds = new HashSet<>(lobby.getMemberIds());
        Map<Integer, Integer> perMatchday = new LinkedHashMap<>();
        int total = 0;
        for (int matchDay = 1; matchDay <= properties.getMatchDays(); matchDay++) {
            List<Team> teams = teamRepository.findByLobbyIdAndMatchDayOrderByIdAsc(lobbyId, matchDay);
            if (teams.size() != properties.getLobbyCapacity()) {
                throw new IncompleteMatchdayException(lobbyId, matchDay, properties.getLobbyCapacity(), teams.size());
            }
            // Une équipe par membre, et seulement des membres
            Set<Long> owners = teams.stream().map(Team::getUserId).collect(Collectors.toSet());
            if (!owners.equals(memberIds)) {
                throw new IncompleteMatchdayException(lobbyId, matchDay,
                        "team owners " + owners + " do not match lobby members " + memberIds);
            }

            List<LeagueMatch> created = scheduleService.generateMatchday(lobby, matchDay, teams);
            perMatchday.put(matchDay, created.size());
            total += created.size();
        }

        lobby.setStatus(LobbyStatus.IN_PROGRESS);
        lobby.setCurrentMatchDay(1);
        lobbyRepository.save(lobby);

        log.info("🚀 Ligue créée pour le lobby {} : {} matchs sur {} journées", lobbyId, total, properties.getMatchDays());
        return new LeagueCreationResult(lobbyId, total, perMatchday);
    }

    public MatchSimulationResult simulateMatch(Long matchId) {
        return matchPlayService.play(matchId);
    }

    /**
     * Simule tous les matchs restants, dans l'ordre (journée, id). Chaque match a sa propre transaction :
     * une relance ne rejoue que les matchs encore non joués.
     */
    public LeagueSimulationResult simulateEntireLeague(Long lobbyId) {
        findLobby(lobbyId);
        List<Long> pending = matchRepository.findByLobbyIdAndPlayedFalseOrderByMatchDayAscIdAsc(lobbyId)
                .stream().map(LeagueMatch::getId).toList();

        log.info("🔄 Lobby {} : simulation de {} matchs restants...", lobbyId, pending.size());
        return runBatch(lobbyId, pending);
    }

    public LeagueSimulationResult simulateMatchday(Long lobbyId, int matchDay) {
        findLobby(lobbyId);
        if (matchDay < 1 || matchDay > properties.getMatchDays()) {
            throw new IllegalArgumentException("Invalid matchday: " + matchDay);
        }
        List<Long> pending = matchRepository.findByLobbyIdAndMatchDayAndPlayedFalseOrderByIdAsc(lobbyId, matchDay)
                .stream().map(LeagueMatch::getId).toList();

        log.info("🔄 Lobby {} : simulation de la journée {} ({} matchs)", lobbyId, matchDay, pending.size());
        return runBatch(lobbyId, pending);
    }

    @Transactional(readOnly = true)
    public LeagueStatus getLeagueStatus(Long lobbyId) {
        Lobby lobby = findLobby(lobbyId);
        List<LeagueMatch> matches = matchRepository.findByLobbyIdOrderByMatchDayAscIdAsc(lobbyId);

        long played = matches.stream().filter(LeagueMatch::isPlayed).count();
        boolean complete = !matches.isEmpty() && played == properties.getTotalMatches();

        List<MatchdayProgress> progress = new ArrayList<>();
        for (int matchDay = 1; matchDay <= properties.getMatchDays(); matchDay++) {
            final int day = matchDay;
            long total = matches.stream().filter(m -> m.getMatchDay() == day).count();
            long done = matches.stream().filter(m -> m.getMatchDay() == day && m.isPlayed()).count();
            progress.add(new MatchdayProgress(day, total, done));
        }

        return LeagueStatus.builder()
                .lobbyId(lobbyId)
                .lobbyStatus(lobby.getStatus())
                .phase(resolvePhase(lobbyId, matches.size(), complete))
                .totalMatches(matches.size())
                .playedMatches(played)
                .currentMatchDay(lobby.getCurrentMatchDay())
                .leagueComplete(complete)
                .matchdayProgress(progress)
                .leagueTable(tableService.buildTable(lobby.getMemberIds(), matches))
                .build();
    }

    @Transactional(readOnly = true)
    public List<LeagueTableEntry> getLeagueTable(Long lobbyId, Integer matchDay) {
        Lobby lobby = findLobby(lobbyId);
        return tableService.buildTable(lobby.getMemberIds(),
                matchRepository.findByLobbyIdOrderByMatchDayAscIdAsc(lobbyId), matchDay);
    }

    @Transactional(readOnly = true)
    public List<MatchView> getMatches(Long lobbyId) {
        findLobby(lobbyId);
        return matchRepository.findByLobbyIdOrderByMatchDayAscIdAsc(lobbyId).stream()
                .map(MatchView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public MatchView getMatch(Long matchId) {
        return matchRepository.findById(matchId)
                .map(MatchView::from)
                .orElseThrow(() -> new MatchNotFoundException(matchId));
    }

    private LeagueSimulationResult runBatch(Long lobbyId, List<Long> matchIds) {
        List<MatchSimulationResult> results = new ArrayList<>();
        for (Long matchId : matchIds) {
            try {
                results.add(matchPlayService.play(matchId));
            } catch (MatchAlreadyPlayedException e) {
                // Joué entre-temps par un autre appel : rien à refaire
                log.warn("Match {} déjà joué, ignoré", matchId);
            }
        }

        boolean complete = matchRepository.countByLobbyIdAndPlayedTrue(lobbyId) == properties.getTotalMatches();
        return new LeagueSimulationResult(lobbyId, results, complete);
    }

    private LeaguePhase resolvePhase(Long lobbyId, int totalMatches, boolean complete) {
        if (totalMatches == 0) return LeaguePhase.NO_LEAGUE;
        if (!complete) return LeaguePhase.SCHEDULED;
        return rewardRepository.existsByLobbyId(lobbyId) ? LeaguePhase.REWARDED : LeaguePhase.COMPLETE;
    }

    private Lobby findLobby(Long lobbyId) {
        return lobbyRepository.findById(lobbyId)
                .orElseThrow(() -> new LobbyNotFoundException(lobbyId));
    }
}
