package com.projectgroup5.blobarena.controller;

import com.projectgroup5.blobarena.GameFixtures;
import com.projectgroup5.blobarena.game.GameManager;
import com.projectgroup5.blobarena.game.snapshot.GameStateSnapshot;
import com.projectgroup5.blobarena.network.NetworkManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("unit")
class GameControllerTest {

    private GameManager gameManager;
    private NetworkManager networkManager;
    private MockMvc mockMvc;

    private static GameStateSnapshot.PlayerView player(int id, String name, long score) {
        return new GameStateSnapshot.PlayerView(id, name, 100, 100, 20 + score, score, List.of(1, 2, 3), null,
                Map.of());
    }

    @BeforeEach
    void setUp() {
        gameManager = mock(GameManager.class);
        networkManager = mock(NetworkManager.class);
        GameStateSnapshot snapshot = new GameStateSnapshot(77, 1000,
                Map.of(1, player(1, "alice", 5), 2, player(2, "bob", 30), 3, player(3, "carol", 30)),
                List.of(new GameStateSnapshot.FoodView(1, 10, 10, 6, "normal", 1, List.of(0, 0, 0))));
        when(gameManager.latestSnapshot()).thenReturn(snapshot);
        when(gameManager.getTickRate()).thenReturn(30);
        when(networkManager.getSessionCount()).thenReturn(4);
        when(networkManager.getActiveSessionCount()).thenReturn(3);

        mockMvc = MockMvcBuilders.standaloneSetup(
                new GameController(gameManager, networkManager, GameFixtures.properties())).build();
    }

    @Test
    void status_reportsSnapshotAndSessionCounts() throws Exception {
        mockMvc.perform(get("/api/game/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(77))
                .andExpect(jsonPath("$.alivePlayers").value(3))
                .andExpect(jsonPath("$.foodCount").value(1))
                .andExpect(jsonPath("$.sessions").value(4))
                .andExpect(jsonPath("$.activeSessions").value(3))
                .andExpect(jsonPath("$.maxPlayers").value(4))
                .andExpect(jsonPath("$.tickRate").value(30));
    }

    @Test
    void scoreboard_sortsByScoreThenId() throws Exception {
        mockMvc.perform(get("/api/game/scoreboard").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("bob"))
                .andExpect(jsonPath("$[1].name").value("carol"));
    }
}
