package com.tony.cardLeague.service;

import com.tony.cardLeague.model.LeagueMatch;
import com.tony.cardLeague.model.LeagueTableEntry;
import com.tony.cardLeague.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tony.cardLeague.model.PlayerColor.*;
import static com.tony.cardLeague.service.ChemistryServiceTest.colors;
import static org.assertj.core.api.Assertions.assertThat;

class LeagueTableServiceTest {

    private static final List<Long> MEMBERS = List.of(1L, 2L, 3L, 4L);

    private LeagueTableService tableService;
    private List<Team> teams;

    @BeforeEach
    void setUp() {
        tableService = new LeagueTableService();
        teams = new ArrayList<>();
        for (long user = 1; user <= 4; user++) {
            teams.add(TeamFixtures.team(user, user, 10, colors(RED, 4, YELLOW, 4, PURPLE, 3)));
        }
    }

    @Test
    @DisplayName("Points = 3 x V + N, différence = BP - BC")
    void entriesShouldFollowScoringRules() {
        List<LeagueMatch> matches = List.of(
                played(1, 2, 3, 1),
                played(3, 4, 2, 2),
                played(1, 3, 0, 1));

        List<LeagueTableEntry> table = tableService.buildTable(MEMBERS, matches);

        assertThat(table).hasSize(4);
        assertThat(table).allSatisfy(e -> {
            assertThat(e.getPoints()).isEqualTo(3 * e.getWins() + e.getDraws());
            assertThat(e.getGoalDifference()).isEqualTo(e.getGoalsFor() - e.getGoalsAgainst());
            assertThat(e.getMatchesPlayed()).isEqualTo(e.getWins() + e.getDraws() + e.getLosses());
        });

        LeagueTableEntry leader = table.get(0);
        assertThat(leader.getUserId()).isEqualTo(3L);
        assertThat(leader.getPoints()).isEqualTo(4);
        assertThat(leader.getRank()).isEqualTo(1);
    }

    @Test
    @DisplayName("Départage : points, différence, buts marqués puis id utilisateur")
    void tieBreakersShouldGiveTotalOrder() {
        List<LeagueMatch> matches = List.of(
                played(1, 2, 5, 4),  // 1: +1 (5 BP)  2: -1
                played(3, 4, 2, 1),  // 3: +1 (2 BP)  4: -1
                played(2, 4, 0, 0)); // 2 et 4 : un nul chacun

        List<LeagueTableEntry> table = tableService.buildTable(MEMBERS, matches);

        assertThat(table).extracting(LeagueTableEntry::getUserId).containsExactly(1L, 3L, 2L, 4L);
        assertThat(table).extracting(LeagueTableEntry::getRank).containsExactly(1, 2, 3, 4);
    }

    @Test
    void identicalRecordsShouldBeOrderedByUserId() {
        List<LeagueTableEntry> table = tableService.buildTable(List.of(4L, 2L, 3L, 1L), List.of());

        assertThat(table).extracting(LeagueTableEntry::getUserId).containsExactly(1L, 2L, 3L, 4L);
        assertThat(table).allSatisfy(e -> assertThat(e.getMatchesPlayed()).isZero());
    }

    @Test
    void unplayedMatchesShouldBeIgnored() {
        LeagueMatch pending = new LeagueMatch(TeamFixtures.lobby(1L), teams.get(0), teams.get(1), 1);

        List<LeagueTableEntry> table = tableService.buildTable(MEMBERS, List.of(pending));

        assertThat(table).allSatisfy(e -> assertThat(e.getPoints()).isZero());
    }

    @Test
    @DisplayName("Reconstruire deux fois donne le même classement")
    void rebuildShouldBeIdempotent() {
        List<LeagueMatch> matches = List.of(played(1, 2, 3, 3), played(2, 3, 1, 0), played(4, 1, 2, 5));

        assertThat(tableService.buildTable(MEMBERS, matches))
                .isEqualTo(tableService.buildTable(MEMBERS, matches));
    }

    @Test
    void matchdayFilterShouldOnlyCountThatMatchday() {
        LeagueMatch day1 = played(1, 2, 4, 0);
        LeagueMatch day2 = played(2, 1, 3, 0);
        day2.setMatchDay(2);

        List<LeagueTableEntry> table = tableService.buildTable(MEMBERS, List.of(day1, day2), 2);

        assertThat(table.get(0).getUserId()).isEqualTo(2L);
        assertThat(table.get(0).getPoints()).isEqualTo(3);
        assertThat(table.get(0).getMatchesPlayed()).isEqualTo(1);
    }

    private LeagueMatch played(int homeUser, int awayUser, int homeScore, int awayScore) {
        LeagueMatch match = new LeagueMatch(TeamFixtures.lobby(1L), teams.get(homeUser - 1), teams.get(awayUser - 1), 1);
        match.recordResult(homeScore, awayScore, 0.5, 0.5, List.of(), null);
        return match;
    }
}
