package com.tony.cardLeague.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
public class TeamSlot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(optional = false)
    private Team team;

    @Column(nullable = false)
    private Integer slotIndex; // 0..10, ordre de la formation

    @ManyToOne
    private Player player; // null = poste vide

    // Snapshot : une modification ultérieure du catalogue ne change pas une équipe déjà alignée
    private Integer snapshotPoints;

    @Enumerated(EnumType.STRING)
    private PlayerColor snapshotColor;

    public TeamSlot(Team team, Integer slotIndex, Player player) {
        this.team = team;
        this.slotIndex = slotIndex;
        this.player = player;
        if (player != null) {
            this.snapshotPoints = player.getPoints();
            this.snapshotColor = player.getColor();
        }
    }

    public boolean isFilled() {
        return player != null;
    }

    public boolean isPlaceholder() {
        return player != null && player.isDummy();
    }
}
