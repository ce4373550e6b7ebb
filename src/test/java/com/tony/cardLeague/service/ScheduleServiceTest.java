package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.exception.ScheduleAlreadyExistsException;
import com.tony.cardLeague.model.LeagueMatch;
import com.tony.cardLeague.model.Lobby;
import com.tony.cardLeague.model.Team;
import com.tony.cardLeague.repository.LeagueMatchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.LongStream;

import static com.tony.cardLeague.model.PlayerColor.*;
import static com.tony.cardLeague.service.ChemistryServiceTest.colors;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

    @Mock
    private LeagueMatchRepository matchRepository;

    private ScheduleService scheduleService;

    @BeforeEach
    void setUp() {
        scheduleService = new ScheduleService(matchRepository, new LeagueProperties());
    }

    @Test
    @DisplayName("4 équipes -> exactement T1T2, T1T3, T1T4, T2T3, T2T4, T3T4")
    void roundRobinShouldProduceTheSixPairings() {
        List<String> pairings = ScheduleService.roundRobin(List.of("T1", "T2", "T3", "T4")).stream()
                .map(p -> p.home() + p.away())
                .toList();

        assertThat(pairings).containsExactly("T1T2", "T1T3", "T1T4", "T2T3", "T2T4", "T3T4");
        assertThat(pairings).doesNotHaveDuplicates();
    }

    @Test
    void roundRobinShouldNeverPairATeamWithItself() {
        assertThat(ScheduleService.roundRobin(List.of(1, 2, 3, 4)))
                .allSatisfy(p -> assertThat(p.home()).isNotEqualTo(p.away()));
    }

    @Test
    void generateMatchdayShouldPersistSixUnplayedMatches() {
        Lobby lobby = TeamFixtures.lobby(1L);
        when(matchRepository.existsByLobbyIdAndMatchDay(1L, 2)).thenReturn(false);
        when(matchRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        List<LeagueMatch> matches = scheduleService.generateMatchday(lobby, 2, fourTeams());

        assertThat(matches).hasSize(6);
        assertThat(matches).allSatisfy(m -> {
            assertThat(m.isPlayed()).isFalse();
            assertThat(m.getMatchDay()).isEqualTo(2);
            assertThat(m.getLobby()).isSameAs(lobby);
        });
        assertThat(matches.get(0).getHomeTeam().getId()).isEqualTo(1L);
        assertThat(matches.get(0).getAwayTeam().getId()).isEqualTo(2L);
    }

    @Test
    void existingMatchdayShouldBeRejected() {
        when(matchRepository.existsByLobbyIdAndMatchDay(1L, 1)).thenReturn(true);

        assertThatThrownBy(() -> scheduleService.generateMatchday(TeamFixtures.lobby(1L), 1, fourTeams()))
                .isInstanceOf(ScheduleAlreadyExistsException.class);
        verify(matchRepository, never()).saveAll(anyList());
    }

    @Test
    void wrongTeamCountShouldBeRejected() {
        List<Team> three = fourTeams().subList(0, 3);

        assertThatThrownBy(() -> scheduleService.generateMatchday(TeamFixtures.lobby(1L), 1, three))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(matchRepository);
    }

    private List<Team> fourTeams() {
        return LongStream.rangeClosed(1, 4)
                .mapToObj(id -> TeamFixtures.team(id, id * 10, 10, colors(RED, 4, YELLOW, 4, PURPLE, 3)))
                .toList();
    }
}
