package com.tony.cardLeague.repository;

import com.tony.cardLeague.model.Reward;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RewardRepository extends JpaRepository<Reward, Long> {

    boolean existsByLobbyId(Long lobbyId);

    List<Reward> findByLobbyIdOrderByPositionAsc(Long lobbyId);
}
