package com.tony.cardLeague.model.dto;

import com.tony.cardLeague.model.PlayerColor;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChemistryBonus {
    private PlayerColor color;
    private int playerCount;
    private int bonus;
}
