package com.projectgroup5.blobarena;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.GameManager;
import com.projectgroup5.blobarena.game.PhysicsEngine;
import com.projectgroup5.blobarena.game.PlayerEntity;
import com.projectgroup5.blobarena.game.TickHook;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

/**
 * 测试用的固定配置：小地图、线性成长、不自动刷食物
 */
public final class GameFixtures {

    public static final long START_MILLIS = 1_000_000L;

    private GameFixtures() {
    }

    public static GameProperties properties() {
        GameProperties props = new GameProperties();
        props.getWorld().setWidth(800);
        props.getWorld().setHeight(600);
        props.getPlayer().setGrowthExponent(1.0);
        props.getPlayer().setGrowthFactor(1.0);
        props.getPlayer().setMinSpawnDistance(60);
        props.getFood().setMinCount(0);
        props.getFood().setMaxCount(0);
        props.getFood().setSpawnRate(0);
        props.getServer().setTickRate(20);
        props.getServer().setMaxPlayers(4);
        return props;
    }

    public static Clock fixedClock() {
        return Clock.fixed(Instant.ofEpochMilli(START_MILLIS), ZoneOffset.UTC);
    }

    public static GameManager gameManager(GameProperties props) {
        return gameManager(props, List.of());
    }

    public static GameManager gameManager(GameProperties props, List<TickHook> hooks) {
        return new GameManager(props, new PhysicsEngine(props), fixedClock(), new Random(42), hooks);
    }

    public static PlayerEntity player(GameProperties props, int id, double x, double y) {
        return new PlayerEntity(id, "player" + id, x, y, List.of(255, 0, 0), props.getPlayer(), props.getSkills());
    }
}
