package com.tony.cardLeague.service;

import com.tony.cardLeague.config.LeagueProperties;
import com.tony.cardLeague.model.PlayerColor;
import com.tony.cardLeague.model.dto.ChemistryBonus;
import com.tony.cardLeague.model.dto.ChemistryResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class ChemistryService {

    private final LeagueProperties properties;

    /**
     * Calcule le bonus de chimie : chaque couleur présente au moins 2 fois rapporte (nombre)².
     * Les couleurs isolées ne rapportent rien. La validité de la composition n'est PAS vérifiée ici
     * (voir {@link #validate(Collection)}) et toutes les couleurs qualifiées sont additionnées sans plafond.
     *
     * @param colors couleurs des postes remplis, cartes de remplissage exclues
     */
    public ChemistryResult evaluate(Collection<PlayerColor> colors) {
        List<ChemistryBonus> breakdown = new ArrayList<>();
        int total = 0;

        for (Map.Entry<PlayerColor, Integer> entry : countByColor(colors).entrySet()) {
            int count = entry.getValue();
            if (count < 2) continue;

            int bonus = count * count;
            breakdown.add(new ChemistryBonus(entry.getKey(), count, bonus));
            total += bonus;
        }

        // Bonus décroissant, puis ordre de l'enum pour rester déterministe
        breakdown.sort(Comparator.comparingInt(ChemistryBonus::getBonus).reversed()
                .thenComparing(ChemistryBonus::getColor));

        return new ChemistryResult(total, breakdown);
    }

    /**
     * Règle d'alignement : exactement N couleurs distinctes (3 par défaut), chacune avec au moins 2 joueurs.
     *
     * @return la liste des violations, vide si la composition est valide
     */
    public List<String> validate(Collection<PlayerColor> colors) {
        List<String> errors = new ArrayList<>();
        Map<PlayerColor, Integer> counts = countByColor(colors);

        if (counts.size() != properties.getRequiredColors()) {
            errors.add(String.format("Team must have exactly %d different colors (found %d)",
                    properties.getRequiredColors(), counts.size()));
        }

        counts.forEach((color, count) -> {
            if (count < properties.getMinPlayersPerColor()) {
                errors.add(String.format("Color %s needs at least %d players (found %d)",
                        color, properties.getMinPlayersPerColor(), count));
            }
        });

        return errors;
    }

    private Map<PlayerColor, Integer> countByColor(Collection<PlayerColor> colors) {
        Map<PlayerColor, Integer> counts = new EnumMap<>(PlayerColor.class);
        for (PlayerColor color : colors) {
            if (color == null) continue;
            counts.merge(color, 1, Integer::sum);
        }
        return counts;
    }
}
