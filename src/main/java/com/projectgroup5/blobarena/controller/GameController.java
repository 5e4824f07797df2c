package com.projectgroup5.blobarena.controller;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.dto.GameScoreEntry;
import com.projectgroup5.blobarena.dto.ServerStatusDto;
import com.projectgroup5.blobarena.game.GameManager;
import com.projectgroup5.blobarena.game.snapshot.GameStateSnapshot;
import com.projectgroup5.blobarena.network.NetworkManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 只读的状态查询接口，数据来自最近一帧快照，不碰世界锁
 */
@RestController
@RequestMapping("/api/game")
@CrossOrigin(origins = "*")
public class GameController {

    private final GameManager gameManager;
    private final NetworkManager networkManager;
    private final GameProperties properties;

    public GameController(GameManager gameManager,
                          NetworkManager networkManager,
                          GameProperties properties) {
        this.gameManager = gameManager;
        this.networkManager = networkManager;
        this.properties = properties;
    }

    @GetMapping("/status")
    public ResponseEntity<ServerStatusDto> getStatus() {
        GameStateSnapshot snapshot = gameManager.latestSnapshot();
        ServerStatusDto dto = new ServerStatusDto();
        dto.setTick(snapshot.tick());
        dto.setAlivePlayers(snapshot.players().size());
        dto.setFoodCount(snapshot.food().size());
        dto.setSessions(networkManager.getSessionCount());
        dto.setActiveSessions(networkManager.getActiveSessionCount());
        dto.setMaxPlayers(properties.getServer().getMaxPlayers());
        dto.setTickRate(gameManager.getTickRate());
        return ResponseEntity.ok(dto);
    }

    /**
     * 排行榜：存活玩家按分数降序，同分按 id
     */
    @GetMapping("/scoreboard")
    public ResponseEntity<List<GameScoreEntry>> getScoreboard(
            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        List<GameScoreEntry> list = gameManager.latestSnapshot().players().values().stream()
                .sorted(Comparator.comparingLong(GameStateSnapshot.PlayerView::score).reversed()
                        .thenComparingInt(GameStateSnapshot.PlayerView::id))
                .limit(Math.max(0, limit))
                .map(p -> new GameScoreEntry(p.id(), p.name(), p.score(), p.radius()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(list);
    }
}
