package com.tony.cardLeague.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "league_match", indexes = {
        @Index(columnList = "lobby_id, match_day")
})
@Getter @Setter @NoArgsConstructor
public class LeagueMatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "lobby_id")
    private Lobby lobby;

    @ManyToOne(optional = false)
    private Team homeTeam;

    @ManyToOne(optional = false)
    private Team awayTeam;

    @Column(name = "match_day", nullable = false)
    private Integer matchDay;

    @Column(nullable = false)
    private Integer homeScore = 0;

    @Column(nullable = false)
    private Integer awayScore = 0;

    @Column(nullable = false)
    private boolean played = false;

    private LocalDateTime playedAt;

    // Probabilités de conversion utilisées lors de la simulation (0..1)
    private Double homeConversionProbability;
    private Double awayConversionProbability;

    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("minute ASC, id ASC")
    private List<MatchEvent> events = new ArrayList<>();

    @Version
    private Long version;

    public LeagueMatch(Lobby lobby, Team homeTeam, Team awayTeam, Integer matchDay) {
        this.lobby = lobby;
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
        this.matchDay = matchDay;
    }

    /**
     * Fige le résultat. Un match joué n'est jamais re-simulé.
     */
    public void recordResult(int homeScore, int awayScore, double homeProbability, double awayProbability,
                             List<MatchEvent> newEvents, LocalDateTime when) {
        if (played) {
            throw new IllegalStateException("Match " + id + " already played");
        }
        this.homeScore = homeScore;
        this.awayScore = awayScore;
        this.homeConversionProbability = homeProbability;
        this.awayConversionProbability = awayProbability;
        this.played = true;
        this.playedAt = when;
        newEvents.forEach(e -> e.setMatch(this));
        this.events.addAll(newEvents);
    }
}
