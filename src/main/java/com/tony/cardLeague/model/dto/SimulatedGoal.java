package com.tony.cardLeague.model.dto;

import com.tony.cardLeague.model.MatchEvent;
import com.tony.cardLeague.model.MatchSide;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimulatedGoal {
    private int minute;
    private MatchSide side;
    private Long playerId;

    public static SimulatedGoal from(MatchEvent event) {
        return new SimulatedGoal(event.getMinute(), event.getSide(), event.getPlayerId());
    }

    public MatchEvent toEvent() {
        return new MatchEvent(minute, side, playerId);
    }
}
