package com.tony.cardLeague.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"lobby_id", "user_id", "match_day"})
})
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @JsonIgnore
    @ManyToOne(optional = false)
    @JoinColumn(name = "lobby_id")
    private Lobby lobby;

    private String formation; // Ex: "4-3-3"

    // Une équipe par joueur et par journée (1..3)
    @Column(name = "match_day", nullable = false)
    private Integer matchDay;

    @OneToMany(mappedBy = "team", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("slotIndex ASC")
    private List<TeamSlot> slots = new ArrayList<>();

    public Team(String name, Long userId, Lobby lobby, Integer matchDay) {
        this.name = name;
        this.userId = userId;
        this.lobby = lobby;
        this.matchDay = matchDay;
    }

    /**
     * Aligne un joueur sur un poste : la note et la couleur sont figées au moment de l'alignement.
     */
    public TeamSlot field(int slotIndex, Player player) {
        TeamSlot slot = new TeamSlot(this, slotIndex, player);
        slots.add(slot);
        return slot;
    }

    public List<TeamSlot> getFilledSlots() {
        return slots.stream().filter(TeamSlot::isFilled).toList();
    }

    // Buteurs possibles : les cartes de remplissage ne marquent pas
    public List<Long> getFieldedPlayerIds() {
        return getFilledSlots().stream()
                .filter(s -> !s.isPlaceholder())
                .map(s -> s.getPlayer().getId())
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
