package com.tony.cardLeague.repository;

import com.tony.cardLeague.model.LeagueMatch;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LeagueMatchRepository extends JpaRepository<LeagueMatch, Long> {

    List<LeagueMatch> findByLobbyIdOrderByMatchDayAscIdAsc(Long lobbyId);

    // Matchs restant à jouer, dans l'ordre déterministe (journée, id)
    List<LeagueMatch> findByLobbyIdAndPlayedFalseOrderByMatchDayAscIdAsc(Long lobbyId);

    List<LeagueMatch> findByLobbyIdAndMatchDayAndPlayedFalseOrderByIdAsc(Long lobbyId, Integer matchDay);

    boolean existsByLobbyId(Long lobbyId);

    boolean existsByLobbyIdAndMatchDay(Long lobbyId, Integer matchDay);

    long countByLobbyId(Long lobbyId);

    long countByLobbyIdAndPlayedTrue(Long lobbyId);

    // Premier simulateur gagnant : le second attend le verrou puis voit played = true
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM LeagueMatch m WHERE m.id = :id")
    Optional<LeagueMatch> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT MIN(m.matchDay) FROM LeagueMatch m WHERE m.lobby.id = :lobbyId AND m.played = false")
    Optional<Integer> findFirstUnplayedMatchDay(@Param("lobbyId") Long lobbyId);
}
