package com.projectgroup5.blobarena.game;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 游戏世界状态（服务器权威）
 * players / food 的所有读写都必须持有 {@link #getLock()}
 */
public class GameWorld {
    private final WorldBounds bounds;
    private final ReentrantLock lock = new ReentrantLock();

    // id -> 玩家（包含等待重生的玩家）
    private final Map<Integer, PlayerEntity> players = new LinkedHashMap<>();
    private final List<FoodEntity> food = new ArrayList<>();

    private long currentTick = 0;
    private long nextFoodId = 1;
    // 超过 minCount 后按速率累积的生成额度
    private double foodSpawnBudget = 0;

    public GameWorld(WorldBounds bounds) {
        this.bounds = bounds;
    }

    public WorldBounds getBounds() {
        return bounds;
    }

    public ReentrantLock getLock() {
        return lock;
    }

    public Map<Integer, PlayerEntity> getPlayers() {
        return players;
    }

    public List<PlayerEntity> getAlivePlayers() {
        return players.values().stream()
                .filter(PlayerEntity::isAlive)
                .collect(Collectors.toList());
    }

    public List<FoodEntity> getFood() {
        return food;
    }

    public long nextFoodId() {
        return nextFoodId++;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public void incrementTick() {
        this.currentTick++;
    }

    public double getFoodSpawnBudget() {
        return foodSpawnBudget;
    }

    public void setFoodSpawnBudget(double foodSpawnBudget) {
        this.foodSpawnBudget = foodSpawnBudget;
    }
}
