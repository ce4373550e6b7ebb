package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.exception.RewardsAlreadyIssuedException;
import com.tony.cardLeague.model.LeagueTableEntry;
import com.tony.cardLeague.model.Reward;
import com.tony.cardLeague.repository.RewardRepository;
import com.tony.cardLeague.repository.UserAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RewardServiceTest {

    @Mock
    private RewardRepository rewardRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    private RewardService rewardService;

    @BeforeEach
    void setUp() {
        rewardService = new RewardService(rewardRepository, userAccountRepository, new LeagueProperties());
    }

    @Test
    @DisplayName("Classement final -> 250 / 200 / 150 / 100 pièces")
    void allocateShouldPayByFinalPosition() {
        when(rewardRepository.existsByLobbyId(7L)).thenReturn(false);
        when(rewardRepository.save(any(Reward.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(userAccountRepository.creditCoins(anyLong(), anyInt())).thenReturn(1);

        List<Reward> rewards = rewardService.allocate(7L, 18, finalTable(30L, 10L, 40L, 20L));

        assertThat(rewards).extracting(Reward::getUserId).containsExactly(30L, 10L, 40L, 20L);
        assertThat(rewards).extracting(Reward::getCoins).containsExactly(250, 200, 150, 100);
        assertThat(rewards).extracting(Reward::getPosition).containsExactly(1, 2, 3, 4);
        assertThat(rewards).allSatisfy(r -> assertThat(r.getLobbyId()).isEqualTo(7L));

        verify(userAccountRepository).creditCoins(30L, 250);
        verify(userAccountRepository).creditCoins(10L, 200);
        verify(userAccountRepository).creditCoins(40L, 150);
        verify(userAccountRepository).creditCoins(20L, 100);
    }

    @Test
    void missingAccountShouldNotBlockTheOtherRewards() {
        when(rewardRepository.existsByLobbyId(7L)).thenReturn(false);
        when(rewardRepository.save(any(Reward.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(userAccountRepository.creditCoins(anyLong(), anyInt())).thenReturn(1);
        when(userAccountRepository.creditCoins(10L, 200)).thenReturn(0);

        List<Reward> rewards = rewardService.allocate(7L, 18, finalTable(30L, 10L, 40L, 20L));

        assertThat(rewards).hasSize(4);
    }

    @Test
    void secondAllocationShouldBeRejected() {
        when(rewardRepository.existsByLobbyId(7L)).thenReturn(true);

        assertThatThrownBy(() -> rewardService.allocate(7L, 18, finalTable(1L, 2L, 3L, 4L)))
                .isInstanceOf(RewardsAlreadyIssuedException.class);
        verify(rewardRepository, never()).save(any());
        verifyNoInteractions(userAccountRepository);
    }

    @Test
    void incompleteLeagueShouldNotBeRewarded() {
        assertThatThrownBy(() -> rewardService.allocate(7L, 17, finalTable(1L, 2L, 3L, 4L)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("17/18");
        verifyNoInteractions(rewardRepository, userAccountRepository);
    }

    private List<LeagueTableEntry> finalTable(Long... userIdsByRank) {
        List<LeagueTableEntry> table = new ArrayList<>();
        for (int i = 0; i < userIdsByRank.length; i++) {
            table.add(LeagueTableEntry.builder().userId(userIdsByRank[i]).rank(i + 1).build());
        }
        return table;
    }
}
