package com.tony.cardLeague.controller;

import com.tony.cardLeague.model.dto.ChemistryReport;
import com.tony.cardLeague.model.dto.TeamStrength;
import com.tony.cardLeague.service.TeamStrengthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/teams")
@RequiredArgsConstructor
public class TeamController {
    private final TeamStrengthService strengthService;

    // 422 si l'équipe n'est pas alignable (incomplète ou hors règles de chimie)
    @GetMapping("/{teamId}/strength")
    public ResponseEntity<TeamStrength> getStrength(@PathVariable Long teamId) {
        return ResponseEntity.ok(strengthService.calculate(teamId));
    }

    @GetMapping("/{teamId}/chemistry")
    public ResponseEntity<ChemistryReport> getChemistry(@PathVariable Long teamId) {
        return ResponseEntity.ok(strengthService.inspect(teamId));
    }
}
