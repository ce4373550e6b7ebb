package com.tony.cardLeague.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"lobby_id", "user_id"})
})
public class LobbyMember {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(optional = false)
    @JoinColumn(name = "lobby_id")
    private Lobby lobby;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    private LocalDateTime joinedAt = LocalDateTime.now();

    public LobbyMember(Lobby lobby, Long userId) {
        this.lobby = lobby;
        this.userId = userId;
    }
}
