package com.tony.cardLeague.repository;

import com.tony.cardLeague.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, Long> {

    // Ordre stable (id croissant) : il détermine les appariements de la journée
    List<Team> findByLobbyIdAndMatchDayOrderByIdAsc(Long lobbyId, Integer matchDay);
}
