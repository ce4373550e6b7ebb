package com.tony.cardLeague.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Data
@NoArgsConstructor
public class UserAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String username;

    // Solde de pièces, seule la distribution des récompenses le modifie ici
    @Column(nullable = false)
    private Integer coins = 1000;

    public UserAccount(String username) {
        this.username = username;
    }
}
