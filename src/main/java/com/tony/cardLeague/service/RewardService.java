package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.exception.RewardsAlreadyIssuedException;
import com.tony.cardLeague.model.LeagueTableEntry;
import com.tony.cardLeague.model.Reward;
import com.tony.cardLeague.repository.RewardRepository;
import com.tony.cardLeague.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class RewardService {

    private final RewardRepository rewardRepository;
    private final UserAccountRepository userAccountRepository;
    private final LeagueProperties properties;

    /**
     * Verse les pièces de fin de ligue selon le classement final (250 / 200 / 150 / 100 par défaut).
     * Une seule distribution par lobby : la contrainte unique (lobby, user) garde la porte en dernier recours.
     */
    @Transactional(noRollbackFor = RewardsAlreadyIssuedException.class)
    public List<Reward> allocate(Long lobbyId, long playedMatches, List<LeagueTableEntry> finalTable) {
        if (playedMatches != properties.getTotalMatches()) {
            throw new IllegalStateException(String.format("League of lobby %d is not complete (%d/%d matches played)",
                    lobbyId, playedMatches, properties.getTotalMatches()));
        }
        if (rewardRepository.existsByLobbyId(lobbyId)) {
            throw new RewardsAlreadyIssuedException(lobbyId);
        }

        List<Reward> rewards = new ArrayList<>();
        for (LeagueTableEntry entry : finalTable) {
            int coins = properties.getRewards().getOrDefault(entry.getRank(), 0);
            if (coins <= 0) continue;

            rewards.add(rewardRepository.save(new Reward(lobbyId, entry.getUserId(), entry.getRank(), coins)));

            int updated = userAccountRepository.creditCoins(entry.getUserId(), coins);
            if (updated == 0) {
                log.warn("⚠️ Récompense enregistrée mais aucun compte pour l'utilisateur {} (lobby {})", entry.getUserId(), lobbyId);
            }
        }

        log.info("💰 Lobby {} : {} récompenses distribuées", lobbyId, rewards.size());
        return rewards;
    }
}
