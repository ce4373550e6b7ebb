package com.tony.cardLeague.repository;

import com.tony.cardLeague.model.Lobby;
import com.tony.cardLeague.model.LobbyStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LobbyRepository extends JpaRepository<Lobby, Long> {

    List<Lobby> findByStatus(LobbyStatus status);

    // Verrou exclusif pour le contrôle de fin de ligue (pas de double récompense)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM Lobby l WHERE l.id = :id")
    Optional<Lobby> findByIdForUpdate(@Param("id") Long id);
}
