package com.tony.cardLeague.model.dto;

import com.tony.cardLeague.model.LeagueMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

// Vue plate d'un match pour l'API (évite de sérialiser le graphe JPA)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchView {
    private Long id;
    private Long lobbyId;
    private Integer matchDay;

    private Long homeTeamId;
    private String homeTeamName;
    private Long homeUserId;

    private Long awayTeamId;
    private String awayTeamName;
    private Long awayUserId;

    private Integer homeScore;
    private Integer awayScore;
    private boolean played;
    private LocalDateTime playedAt;

    private Double homeConversionProbability;
    private Double awayConversionProbability;

    private List<SimulatedGoal> events;

    public static MatchView from(LeagueMatch m) {
        return MatchView.builder()
                .id(m.getId())
                .lobbyId(m.getLobby().getId())
                .matchDay(m.getMatchDay())
                .homeTeamId(m.getHomeTeam().getId())
                .homeTeamName(m.getHomeTeam().getName())
                .homeUserId(m.getHomeTeam().getUserId())
                .awayTeamId(m.getAwayTeam().getId())
                .awayTeamName(m.getAwayTeam().getName())
                .awayUserId(m.getAwayTeam().getUserId())
                .homeScore(m.getHomeScore())
                .awayScore(m.getAwayScore())
                .played(m.isPlayed())
                .playedAt(m.getPlayedAt())
                .homeConversionProbability(m.getHomeConversionProbability())
                .awayConversionProbability(m.getAwayConversionProbability())
                .events(m.getEvents().stream().map(SimulatedGoal::from).toList())
                .build();
    }
}
