package com.tony.cardLeague.service;

import com.tony.cardLeague.model.LeagueMatch;
import com.tony.cardLeague.model.LeagueTableEntry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class LeagueTableService {

    // Points (Desc) -> Différence de buts (Desc) -> Buts marqués (Desc) -> id utilisateur (Asc)
    public static final Comparator<LeagueTableEntry> STANDINGS_ORDER =
            Comparator.comparingInt(LeagueTableEntry::getPoints).reversed()
                    .thenComparing(Comparator.comparingInt(LeagueTableEntry::getGoalDifference).reversed())
                    .thenComparing(Comparator.comparingInt(LeagueTableEntry::getGoalsFor).reversed())
                    .thenComparing(LeagueTableEntry::getUserId);

    public List<LeagueTableEntry> buildTable(Collection<Long> memberIds, List<LeagueMatch> matches) {
        return buildTable(memberIds, matches, null);
    }

    /**
     * Reconstruit le classement complet depuis le journal des matchs (aucun état incrémental).
     * Chaque membre a une ligne, même sans match joué. Les matchs non joués sont ignorés.
     *
     * @param matchDay si non null, ne compte que cette journée
     */
    public List<LeagueTableEntry> buildTable(Collection<Long> memberIds, List<LeagueMatch> matches, Integer matchDay) {
        Map<Long, LeagueTableEntry> byUser = new LinkedHashMap<>();
        memberIds.forEach(userId -> byUser.put(userId, emptyEntry(userId)));

        for (LeagueMatch m : matches) {
            if (!m.isPlayed()) continue;
            if (matchDay != null && !matchDay.equals(m.getMatchDay())) continue;

            LeagueTableEntry home = byUser.computeIfAbsent(m.getHomeTeam().getUserId(), this::emptyEntry);
            LeagueTableEntry away = byUser.computeIfAbsent(m.getAwayTeam().getUserId(), this::emptyEntry);

            applyResult(home, m.getHomeScore(), m.getAwayScore());
            applyResult(away, m.getAwayScore(), m.getHomeScore());
        }

        List<LeagueTableEntry> table = new ArrayList<>(byUser.values());
        table.sort(STANDINGS_ORDER);

        int rank = 1;
        for (LeagueTableEntry entry : table) {
            entry.setRank(rank++);
        }
        return table;
    }

    private void applyResult(LeagueTableEntry entry, int scored, int conceded) {
        entry.setMatchesPlayed(entry.getMatchesPlayed() + 1);
        entry.setGoalsFor(entry.getGoalsFor() + scored);
        entry.setGoalsAgainst(entry.getGoalsAgainst() + conceded);
        entry.setGoalDifference(entry.getGoalsFor() - entry.getGoalsAgainst());

        if (scored > conceded) {
            entry.setWins(entry.getWins() + 1);
            entry.setPoints(entry.getPoints() + 3);
        } else if (scored == conceded) {
            entry.setDraws(entry.getDraws() + 1);
            entry.setPoints(entry.getPoints() + 1);
        } else {
            entry.setLosses(entry.getLosses() + 1);
        }
    }

    private LeagueTableEntry emptyEntry(Long userId) {
        return LeagueTableEntry.builder().userId(userId).build();
    }
}
