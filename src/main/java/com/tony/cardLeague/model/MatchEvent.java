package com.tony.cardLeague.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Entity
@Data
@NoArgsConstructor
public class MatchEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private LeagueMatch match;

    // "minute" est un mot réservé sous H2
    @Column(name = "goal_minute")
    private Integer minute; // 1..90

    @Enumerated(EnumType.STRING)
    private MatchSide side;

    private Long playerId; // Le buteur (optionnel)

    @Enumerated(EnumType.STRING)
    private EventType type;

    public enum EventType { GOAL }

    public MatchEvent(Integer minute, MatchSide side, Long playerId) {
        this.minute = minute;
        this.side = side;
        this.playerId = playerId;
        this.type = EventType.GOAL;
    }
}
