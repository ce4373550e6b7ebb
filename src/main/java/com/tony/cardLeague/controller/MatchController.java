package com.tony.cardLeague.controller;

import com.tony.cardLeague.model.dto.MatchSimulationResult;
import com.tony.cardLeague.model.dto.MatchView;
import com.tony.cardLeague.service.LeagueOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/matches")
@RequiredArgsConstructor
public class MatchController {
    private final LeagueOrchestrator orchestrator;

    @GetMapping("/{matchId}")
    public ResponseEntity<MatchView> getMatch(@PathVariable Long matchId) {
        return ResponseEntity.ok(orchestrator.getMatch(matchId));
    }

    @PostMapping("/{matchId}/simulate")
    public ResponseEntity<MatchSimulationResult> simulateMatch(@PathVariable Long matchId) {
        return ResponseEntity.ok(orchestrator.simulateMatch(matchId));
    }
}
