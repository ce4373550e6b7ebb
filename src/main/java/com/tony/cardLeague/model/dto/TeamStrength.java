package com.tony.cardLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamStrength {
    private Long teamId;
    private int playerPoints;    // Somme des 11 notes figées
    private int chemistryPoints; // Bonus de chimie
    private int totalStrength;

    @Builder.Default
    private List<ChemistryBonus> chemistryBreakdown = new ArrayList<>();
}
