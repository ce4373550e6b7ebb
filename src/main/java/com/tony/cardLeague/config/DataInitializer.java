package com.tony.cardLeague.config;

import com.tony.cardLeague.model.Player;
import com.tony.cardLeague.model.PlayerColor;
import com.tony.cardLeague.model.PlayerPosition;
import com.tony.cardLeague.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {
    private final PlayerRepository playerRepository;

    private static final PlayerPosition[] LINEUP = {
            PlayerPosition.GK, PlayerPosition.LB, PlayerPosition.CB, PlayerPosition.CB, PlayerPosition.RB,
            PlayerPosition.CDM, PlayerPosition.CM, PlayerPosition.CAM,
            PlayerPosition.LW, PlayerPosition.ST, PlayerPosition.RW
    };

    @Override
    public void run(String... args) {
        // On ne remplit que si le catalogue est vide
        if (playerRepository.count() > 0) return;

        log.info("🌱 Initialisation du catalogue de cartes...");
        List<Player> catalog = new ArrayList<>();

        // Carte de remplissage : ne compte pas dans la chimie
        Player dummy = new Player("Dummy", 1, PlayerPosition.CM, PlayerColor.LIGHT_BLUE);
        dummy.setTheme(Player.DUMMY_THEME);
        catalog.add(dummy);

        // Un onze de base par couleur, notes de 60 à 80
        for (PlayerColor color : PlayerColor.values()) {
            for (int i = 0; i < LINEUP.length; i++) {
                String name = color.name().charAt(0) + color.name().substring(1).toLowerCase() + " #" + (i + 1);
                Player player = new Player(name, 60 + (i * 2), LINEUP[i], color);
                player.setTheme("STANDARD");
                catalog.add(player);
            }
        }

        playerRepository.saveAll(catalog);
        log.info("✅ {} cartes créées", catalog.size());
    }
}
