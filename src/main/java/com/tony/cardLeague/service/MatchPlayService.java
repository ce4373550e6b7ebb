package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.exception.LobbyNotFoundException;
import com.tony.cardLeague.exception.MatchAlreadyPlayedException;
import com.tony.cardLeague.exception.MatchNotFoundException;
import com.tony.cardLeague.model.LeagueMatch;
import com.tony.cardLeague.model.LeagueTableEntry;
import com.tony.cardLeague.model.Lobby;
import com.tony.cardLeague.model.LobbyStatus;
import com.tony.cardLeague.model.dto.MatchSimulation;
import com.tony.cardLeague.model.dto.MatchSimulationResult;
import com.tony.cardLeague.model.dto.SimulatedGoal;
import com.tony.cardLeague.model.dto.TeamStrength;
import com.tony.cardLeague.repository.LeagueMatchRepository;
import com.tony.cardLeague.repository.LobbyRepository;
import com.tony.cardLeague.repository.RewardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Unité atomique "simuler puis persister" d'un match, avec le contrôle de fin de ligue.
 * Bean séparé de l'orchestrateur pour que chaque match ait sa propre transaction dans les traitements par lot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchPlayService {

    private final LeagueMatchRepository matchRepository;
    private final LobbyRepository lobbyRepository;
    private final RewardRepository rewardRepository;
    private final TeamStrengthService strengthService;
    private final MatchSimulationService simulationService;
    private final LeagueTableService tableService;
    private final RewardService rewardService;
    private final LeagueProperties properties;

    @Transactional
    public MatchSimulationResult play(Long matchId) {
        // Verrou sur la ligne du match : le second appel concurrent attend puis voit played = true
        LeagueMatch match = matchRepository.findByIdForUpdate(matchId)
                .orElseThrow(() -> new MatchNotFoundException(matchId));

        if (match.isPlayed()) {
            throw new MatchAlreadyPlayedException(matchId);
        }

        TeamStrength home = strengthService.calculate(match.getHomeTeam());
        TeamStrength away = strengthService.calculate(match.getAwayTeam());

        MatchSimulation simulation = simulationService.simulate(
                home.getTotalStrength(), away.getTotalStrength(),
                match.getHomeTeam().getFieldedPlayerIds(), match.getAwayTeam().getFieldedPlayerIds());

        match.recordResult(simulation.getHomeScore(), simulation.getAwayScore(),
                simulation.getHomeConversionProbability(), simulation.getAwayConversionProbability(),
                simulation.getEvents().stream().map(SimulatedGoal::toEvent).toList(),
                LocalDateTime.now());
        matchRepository.save(match);

        log.info("⚽ Match {} (J{}) : {} {} - {} {} (force {} vs {})",
                match.getId(), match.getMatchDay(),
                match.getHomeTeam().getName(), simulation.getHomeScore(),
                simulation.getAwayScore(), match.getAwayTeam().getName(),
                home.getTotalStrength(), away.getTotalStrength());

        boolean leagueComplete = advanceLobby(match.getLobby().getId());

        return MatchSimulationResult.builder()
                .matchId(match.getId())
                .matchDay(match.getMatchDay())
                .homeTeamId(match.getHomeTeam().getId())
                .awayTeamId(match.getAwayTeam().getId())
                .homeScore(simulation.getHomeScore())
                .awayScore(simulation.getAwayScore())
                .homeStrength(home.getTotalStrength())
                .awayStrength(away.getTotalStrength())
                .homeConversionProbability(simulation.getHomeConversionProbability())
                .awayConversionProbability(simulation.getAwayConversionProbability())
                .events(simulation.getEvents())
                .leagueComplete(leagueComplete)
                .build();
    }

    /**
     * Avance le compteur de journée et clôture la ligue quand tous les matchs sont joués.
     * Se fait dans la même transaction que l'enregistrement du match, lobby verrouillé.
     *
     * @return true si la ligue est complète
     */
    private boolean advanceLobby(Long lobbyId) {
        Lobby lobby = lobbyRepository.findByIdForUpdate(lobbyId)
                .orElseThrow(() -> new LobbyNotFoundException(lobbyId));

        long played = matchRepository.countByLobbyIdAndPlayedTrue(lobbyId);
        matchRepository.findFirstUnplayedMatchDay(lobbyId).ifPresent(lobby::setCurrentMatchDay);

        if (played < properties.getTotalMatches()) {
            lobbyRepository.save(lobby);
            return false;
        }

        if (rewardRepository.existsByLobbyId(lobbyId)) {
            log.warn("Lobby {} : récompenses déjà versées, distribution ignorée", lobbyId);
        } else {
            List<LeagueTableEntry> finalTable = tableService.buildTable(
                    lobby.getMemberIds(), matchRepository.findByLobbyIdOrderByMatchDayAscIdAsc(lobbyId));
            rewardService.allocate(lobbyId, played, finalTable);
        }

        lobby.setStatus(LobbyStatus.FINISHED);
        lobbyRepository.save(lobby);
        log.info("🏆 Ligue du lobby {} terminée ({} matchs joués)", lobbyId, played);
        return true;
    }
}
