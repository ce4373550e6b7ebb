package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.exception.IncompleteTeamException;
import com.tony.cardLeague.exception.InvalidChemistryException;
import com.tony.cardLeague.exception.TeamNotFoundException;
import com.tony.cardLeague.model.PlayerColor;
import com.tony.cardLeague.model.Team;
import com.tony.cardLeague.model.TeamSlot;
import com.tony.cardLeague.model.dto.ChemistryReport;
import com.tony.cardLeague.model.dto.ChemistryResult;
import com.tony.cardLeague.model.dto.TeamStrength;
import com.tony.cardLeague.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class TeamStrengthService {

    private final ChemistryService chemistryService;
    private final TeamRepository teamRepository;
    private final LeagueProperties properties;

    /**
     * Force = somme des 11 notes figées + bonus de chimie.
     * Une équipe incomplète ou hors règles de couleurs est rejetée, jamais ramenée à 0.
     */
    public TeamStrength calculate(Team team) {
        List<TeamSlot> filled = team.getFilledSlots();
        if (filled.size() < properties.getPlayersPerTeam()) {
            throw new IncompleteTeamException(team.getId(), filled.size(), properties.getPlayersPerTeam());
        }

        List<PlayerColor> colors = chemistryColors(team);
        List<String> violations = chemistryService.validate(colors);
        if (!violations.isEmpty()) {
            throw new InvalidChemistryException(team.getId(), violations);
        }

        int playerPoints = filled.stream().mapToInt(this::ratingOf).sum();
        ChemistryResult chemistry = chemistryService.evaluate(colors);

        return TeamStrength.builder()
                .teamId(team.getId())
                .playerPoints(playerPoints)
                .chemistryPoints(chemistry.getTotalBonus())
                .totalStrength(playerPoints + chemistry.getTotalBonus())
                .chemistryBreakdown(chemistry.getBreakdown())
                .build();
    }

    @Transactional(readOnly = true)
    public TeamStrength calculate(Long teamId) {
        return calculate(findTeam(teamId));
    }

    /**
     * Diagnostic de composition pour l'IHM : ne lève pas d'exception sur une équipe invalide.
     */
    @Transactional(readOnly = true)
    public ChemistryReport inspect(Long teamId) {
        Team team = findTeam(teamId);
        List<PlayerColor> colors = chemistryColors(team);
        List<String> violations = chemistryService.validate(colors);
        ChemistryResult chemistry = chemistryService.evaluate(colors);

        return new ChemistryReport(teamId, team.getFilledSlots().size(), violations.isEmpty(), violations,
                chemistry.getTotalBonus(), chemistry.getBreakdown());
    }

    // Les cartes de remplissage ne comptent pas dans la chimie
    private List<PlayerColor> chemistryColors(Team team) {
        return team.getFilledSlots().stream()
                .filter(slot -> !slot.isPlaceholder())
                .map(slot -> slot.getSnapshotColor() != null ? slot.getSnapshotColor() : slot.getPlayer().getColor())
                .toList();
    }

    private int ratingOf(TeamSlot slot) {
        if (slot.getSnapshotPoints() != null) return slot.getSnapshotPoints();
        // Anciennes lignes sans snapshot : on retombe sur la note du catalogue
        Integer catalog = slot.getPlayer().getPoints();
        return catalog != null ? catalog : 0;
    }

    private Team findTeam(Long teamId) {
        return teamRepository.findById(teamId)
                .orElseThrow(() -> new TeamNotFoundException(teamId));
    }
}
