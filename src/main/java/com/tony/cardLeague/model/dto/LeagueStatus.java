package com.tony.cardLeague.model.dto;

import com.tony.cardLeague.model.LeaguePhase;
import com.tony.cardLeague.model.LeagueTableEntry;
import com.tony.cardLeague.model.LobbyStatus;
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
public class LeagueStatus {
    private Long lobbyId;
    private LobbyStatus lobbyStatus;
    private LeaguePhase phase;

    private long totalMatches;
    private long playedMatches;
    private int currentMatchDay;
    private boolean leagueComplete;

    @Builder.Default
    private List<MatchdayProgress> matchdayProgress = new ArrayList<>();

    @Builder.Default
    private List<LeagueTableEntry> leagueTable = new ArrayList<>();
}
