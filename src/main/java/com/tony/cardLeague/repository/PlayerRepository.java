package com.tony.cardLeague.repository;

import com.tony.cardLeague.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, Long> {
    Optional<Player> findFirstByTheme(String theme);
}
