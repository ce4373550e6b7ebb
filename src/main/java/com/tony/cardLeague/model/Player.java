package com.tony.cardLeague.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Data
@NoArgsConstructor
public class Player {
    public static final String DUMMY_THEME = "DUMMY";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // Note de la carte (= sa contribution à la force de l'équipe)
    @Column(nullable = false)
    private Integer points;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlayerPosition position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlayerColor color;

    private String theme; // Ex: "STANDARD", "DUMMY" (carte de remplissage)

    public Player(String name, Integer points, PlayerPosition position, PlayerColor color) {
        this.name = name;
        this.points = points;
        this.position = position;
        this.color = color;
    }

    public boolean isDummy() {
        return DUMMY_THEME.equals(theme);
    }
}
