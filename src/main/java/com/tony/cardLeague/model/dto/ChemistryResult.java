package com.tony.cardLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ChemistryResult {
    private int totalBonus;
    private List<ChemistryBonus> breakdown; // Trié par bonus décroissant
}
