package com.tony.cardLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ChemistryReport {
    private Long teamId;
    private int filledSlots;
    private boolean valid;
    private List<String> violations;
    private int totalBonus;
    private List<ChemistryBonus> breakdown;
}
