package com.tony.cardLeague.controller;

import com.tony.cardLeague.model.LeagueTableEntry;
import com.tony.cardLeague.model.dto.LeagueCreationResult;
import com.tony.cardLeague.model.dto.LeagueSimulationResult;
import com.tony.cardLeague.model.dto.LeagueStatus;
import com.tony.cardLeague.model.dto.MatchView;
import com.tony.cardLeague.service.LeagueOrchestrator;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/lobbies/{lobbyId}")
@RequiredArgsConstructor
@Slf4j
@Validated
public class LeagueController {
    private final LeagueOrchestrator orchestrator;

    @PostMapping("/league")
    public ResponseEntity<LeagueCreationResult> createLeague(@PathVariable Long lobbyId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(orchestrator.createLeague(lobbyId));
    }

    @GetMapping("/league/status")
    public ResponseEntity<LeagueStatus> getLeagueStatus(@PathVariable Long lobbyId) {
        return ResponseEntity.ok(orchestrator.getLeagueStatus(lobbyId));
    }

    // ?matchDay=2 pour le classement d'une seule journée
    @GetMapping("/league/table")
    public ResponseEntity<List<LeagueTableEntry>> getLeagueTable(
            @PathVariable Long lobbyId,
            @RequestParam(required = false) @Min(1) Integer matchDay) {
        return ResponseEntity.ok(orchestrator.getLeagueTable(lobbyId, matchDay));
    }

    @PostMapping("/league/simulate")
    public ResponseEntity<LeagueSimulationResult> simulateEntireLeague(@PathVariable Long lobbyId) {
        log.info("🚀 Simulation complète demandée pour le lobby {}", lobbyId);
        return ResponseEntity.ok(orchestrator.simulateEntireLeague(lobbyId));
    }

    @PostMapping("/league/matchdays/{matchDay}/simulate")
    public ResponseEntity<LeagueSimulationResult> simulateMatchday(@PathVariable Long lobbyId, @PathVariable @Min(1) int matchDay) {
        return ResponseEntity.ok(orchestrator.simulateMatchday(lobbyId, matchDay));
    }

    @GetMapping("/matches")
    public ResponseEntity<List<MatchView>> getLobbyMatches(@PathVariable Long lobbyId) {
        return ResponseEntity.ok(orchestrator.getMatches(lobbyId));
    }
}
