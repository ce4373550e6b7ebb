package com.tony.cardLeague.controller;

import com.tony.cardLeague.exception.LobbyNotFoundException;
import com.tony.cardLeague.exception.LobbyNotFullException;
import com.tony.cardLeague.exception.MatchAlreadyPlayedException;
import com.tony.cardLeague.model.dto.LeagueCreationResult;
import com.tony.cardLeague.service.LeagueOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({LeagueController.class, MatchController.class})
class LeagueControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LeagueOrchestrator orchestrator;

    @Test
    void createLeagueShouldReturnCreated() throws Exception {
        when(orchestrator.createLeague(1L)).thenReturn(new LeagueCreationResult(1L, 18, Map.of(1, 6, 2, 6, 3, 6)));

        mockMvc.perform(post("/api/v1/lobbies/1/league"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.totalMatches").value(18));
    }

    @Test
    @DisplayName("Lobby incomplet -> 422 avec le message d'erreur")
    void lobbyNotFullShouldBeUnprocessable() throws Exception {
        when(orchestrator.createLeague(1L)).thenThrow(new LobbyNotFullException(1L, 3, 4));

        mockMvc.perform(post("/api/v1/lobbies/1/league"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value(422))
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void unknownLobbyShouldBeNotFound() throws Exception {
        when(orchestrator.getLeagueStatus(9L)).thenThrow(new LobbyNotFoundException(9L));

        mockMvc.perform(get("/api/v1/lobbies/9/league/status"))
                .andExpect(status().isNotFound());
    }

    @Test
    void replayingAMatchShouldConflict() throws Exception {
        when(orchestrator.simulateMatch(5L)).thenThrow(new MatchAlreadyPlayedException(5L));

        mockMvc.perform(post("/api/v1/matches/5/simulate"))
                .andExpect(status().isConflict());
    }

    @Test
    void matchdayZeroShouldBeRejected() throws Exception {
        mockMvc.perform(post("/api/v1/lobbies/1/league/matchdays/0/simulate"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(orchestrator);
    }
}
