package com.tony.cardLeague.job;

import com.tony.cardLeague.model.Lobby;
import com.tony.cardLeague.model.LobbyStatus;
import com.tony.cardLeague.model.dto.LeagueSimulationResult;
import com.tony.cardLeague.repository.LobbyRepository;
import com.tony.cardLeague.service.LeagueOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "league.autoplay", name = "enabled", havingValue = "true")
public class LeagueAutoplayJob {

    private final LobbyRepository lobbyRepository;
    private final LeagueOrchestrator orchestrator;

    /**
     * Joue les matchs restants de toutes les ligues en cours.
     * Un lobby en erreur (équipe invalide...) n'empêche pas les autres d'avancer.
     */
    @Scheduled(cron = "${league.autoplay.cron:0 */15 * * * *}")
    public void playPendingLeagues() {
        List<Lobby> lobbies = lobbyRepository.findByStatus(LobbyStatus.IN_PROGRESS);
        log.info("⏰ [CRON] {} ligues en cours à faire avancer", lobbies.size());

        for (Lobby lobby : lobbies) {
            try {
                LeagueSimulationResult result = orchestrator.simulateEntireLeague(lobby.getId());
                log.info("   -> Lobby {} : {} matchs joués, terminée = {}",
                        lobby.getId(), result.getResults().size(), result.isLeagueComplete());
            } catch (Exception e) {
                log.error("❌ [CRON] Echec de la simulation du lobby {}", lobby.getId(), e);
            }
        }
    }
}
