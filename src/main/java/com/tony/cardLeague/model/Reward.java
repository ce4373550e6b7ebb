package com.tony.cardLeague.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Data
@NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"lobby_id", "user_id"})
})
public class Reward {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lobby_id", nullable = false)
    private Long lobbyId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    private Integer position; // Classement final (1..4)

    private Integer coins;

    private LocalDateTime issuedAt;

    public Reward(Long lobbyId, Long userId, Integer position, Integer coins) {
        this.lobbyId = lobbyId;
        this.userId = userId;
        this.position = position;
        this.coins = coins;
        this.issuedAt = LocalDateTime.now();
    }
}
