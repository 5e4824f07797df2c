package com.projectgroup5.blobarena.game;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.skill.Skill;
import com.projectgroup5.blobarena.game.snapshot.GameStateSnapshot;
import com.projectgroup5.blobarena.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 模拟核心 - 持有权威的 players / food，每帧按固定顺序推进一次
 *
 * 每帧顺序:
 * 移动意图 → 技能 → 玩家吃食物 → 玩家互吃 → 死亡/重生 → 补充食物 → 扩展钩子 → 快照
 *
 * 网络线程只通过 recordMove / activateSkill / addPlayer / removePlayer 进入短临界区，
 * 广播线程只读取 {@link #latestSnapshot()}
 */
@Component
public class GameManager {
    private static final Logger logger = LoggerFactory.getLogger(GameManager.class);

    private final GameProperties properties;
    private final PhysicsEngine physicsEngine;
    private final Clock clock;
    private final Random random;
    private final List<TickHook> tickHooks;

    private final GameWorld world;
    private final SpawnLocator spawnLocator;
    private final double deltaTime;

    private volatile GameStateSnapshot latestSnapshot;

    @Autowired
    public GameManager(GameProperties properties,
                       PhysicsEngine physicsEngine,
                       Clock clock,
                       Random random,
                       ObjectProvider<TickHook> tickHooks) {
        this(properties, physicsEngine, clock, random, tickHooks.orderedStream().collect(Collectors.toList()));
    }

    public GameManager(GameProperties properties,
                       PhysicsEngine physicsEngine,
                       Clock clock,
                       Random random,
                       List<TickHook> tickHooks) {
        properties.validate();
        this.properties = properties;
        this.physicsEngine = physicsEngine;
        this.clock = clock;
        this.random = random;
        this.tickHooks = List.copyOf(tickHooks);

        GameProperties.World w = properties.getWorld();
        this.world = new GameWorld(new WorldBounds(w.getWidth(), w.getHeight()));
        this.spawnLocator = new SpawnLocator(world.getBounds(), w.getPadding(), random);
        this.deltaTime = 1.0 / properties.getServer().getTickRate();

        initializeFood();
        this.latestSnapshot = buildSnapshot(clock.millis());
        logger.info("GameManager ready: world={}, food={}, tickRate={}",
                world.getBounds(), world.getFood().size(), properties.getServer().getTickRate());
    }

    private void initializeFood() {
        int min = properties.getFood().getMinCount();
        while (world.getFood().size() < min) {
            spawnFood();
        }
    }

    // ==================== 会话线程调用（短临界区） ====================

    /**
     * 握手成功后把玩家放进世界
     *
     * @return 出生点
     * @throws ValidationException 重名或服务器已满
     */
    public Point addPlayer(int id, String name) throws ValidationException {
        ReentrantLock lock = world.getLock();
        lock.lock();
        try {
            if (world.getPlayers().size() >= properties.getServer().getMaxPlayers()) {
                throw new ValidationException(ValidationException.Reason.SERVER_FULL,
                        "Server is full (" + properties.getServer().getMaxPlayers() + " players)");
            }
            if (isNameTakenLocked(name)) {
                throw new ValidationException(ValidationException.Reason.NAME_TAKEN, "Name already taken: " + name);
            }

            GameProperties.Player cfg = properties.getPlayer();
            Point spawn = spawnLocator.findPlayerSpawn(world.getAlivePlayers(), cfg.getBaseRadius(),
                    cfg.getMinSpawnDistance(), cfg.getSpawnAttempts());
            PlayerEntity player = new PlayerEntity(id, name, spawn.x(), spawn.y(), pickColor(cfg.getColors()),
                    cfg, properties.getSkills());
            player.clampInto(world.getBounds());
            tickHooks.forEach(h -> h.onPlayerSpawned(player));
            world.getPlayers().put(id, player);

            logger.info("Created player {} (id={}) at ({}, {})", name, id, player.getX(), player.getY());
            return new Point(player.getX(), player.getY());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 移除玩家，重复调用无副作用
     */
    public boolean removePlayer(int id) {
        ReentrantLock lock = world.getLock();
        lock.lock();
        try {
            PlayerEntity removed = world.getPlayers().remove(id);
            if (removed != null) {
                logger.info("Removed player {} (id={})", removed.getName(), id);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public boolean isNameTaken(String name) {
        ReentrantLock lock = world.getLock();
        lock.lock();
        try {
            return isNameTakenLocked(name);
        } finally {
            lock.unlock();
        }
    }

    private boolean isNameTakenLocked(String name) {
        return world.getPlayers().values().stream().anyMatch(p -> p.getName().equalsIgnoreCase(name));
    }

    /**
     * 记录移动意图，下一帧生效
     *
     * @return false 表示玩家不存在或序号过期
     */
    public boolean recordMove(int id, double dx, double dy, long sequence) {
        ReentrantLock lock = world.getLock();
        lock.lock();
        try {
            PlayerEntity player = world.getPlayers().get(id);
            if (player == null) {
                return false;
            }
            return player.recordIntent(dx, dy, sequence);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 激活技能；结果不回包，下一帧快照里可见
     */
    public boolean activateSkill(int id, String skillName) {
        ReentrantLock lock = world.getLock();
        lock.lock();
        try {
            PlayerEntity player = world.getPlayers().get(id);
            if (player == null || !player.isAlive()) {
                return false;
            }
            Skill skill = player.getSkill(skillName);
            if (skill == null) {
                logger.warn("Player {} requested unknown skill '{}'", player.getName(), skillName);
                return false;
            }
            boolean activated = skill.activate(clock.millis());
            logger.debug("Player {} skill {} activated={}", player.getName(), skillName, activated);
            return activated;
        } finally {
            lock.unlock();
        }
    }

    public GameStateSnapshot latestSnapshot() {
        return latestSnapshot;
    }

    // ==================== 主循环 ====================

    public GameStateSnapshot tick() {
        return tick(clock.millis(), deltaTime);
    }

    /**
     * 推进一帧。整个模拟步骤持有世界锁，快照在锁内复制、锁外广播
     */
    public GameStateSnapshot tick(long now, double dt) {
        ReentrantLock lock = world.getLock();
        lock.lock();
        try {
            // 1) 移动
            physicsEngine.applyIntents(world, dt);
            // 2) 技能
            physicsEngine.resolveSkills(world, now);
            // 3) 吃食物
            physicsEngine.consumeFood(world);
            // 4) 玩家互吃
            physicsEngine.resolvePlayerCollisions(world, now);
            // 5) 重生
            handleRespawns(now);
            // 6) 补充食物
            replenishFood(dt);

            for (TickHook hook : tickHooks) {
                hook.onTick(world, now, dt);
            }
            physicsEngine.sanitize(world);

            world.incrementTick();
            // 7) 快照
            GameStateSnapshot snapshot = buildSnapshot(now);
            latestSnapshot = snapshot;
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    private void handleRespawns(long now) {
        GameProperties.Player cfg = properties.getPlayer();
        for (PlayerEntity player : world.getPlayers().values()) {
            if (player.isAlive() || now < player.getRespawnAt()) {
                continue;
            }
            Point spawn = spawnLocator.findPlayerSpawn(world.getAlivePlayers(), cfg.getBaseRadius(),
                    cfg.getMinSpawnDistance(), cfg.getSpawnAttempts());
            player.respawn(spawn.x(), spawn.y());
            player.clampInto(world.getBounds());
            tickHooks.forEach(h -> h.onPlayerSpawned(player));
            logger.info("Player {} respawned at ({}, {})", player.getName(), player.getX(), player.getY());
        }
    }

    /**
     * 低于 minCount 立即补齐；之后按 spawnRate 逐步补到 maxCount
     */
    private void replenishFood(double dt) {
        GameProperties.Food cfg = properties.getFood();
        List<FoodEntity> food = world.getFood();

        while (food.size() < cfg.getMinCount()) {
            spawnFood();
        }

        if (food.size() >= cfg.getMaxCount()) {
            world.setFoodSpawnBudget(0);
            return;
        }
        // 额度最多累积一秒的量
        double budget = Math.min(world.getFoodSpawnBudget() + cfg.getSpawnRate() * dt, Math.max(1.0, cfg.getSpawnRate()));
        while (budget >= 1.0 && food.size() < cfg.getMaxCount()) {
            spawnFood();
            budget -= 1.0;
        }
        world.setFoodSpawnBudget(budget);
    }

    private void spawnFood() {
        GameProperties.Food cfg = properties.getFood();
        Point spot = spawnLocator.findFoodSpot(world.getAlivePlayers(), cfg.getRadius(),
                cfg.getMinPlayerDistance(), properties.getPlayer().getSpawnAttempts());
        FoodEntity f = new FoodEntity(world.nextFoodId(), spot.x(), spot.y(), cfg.getRadius(), cfg.getValue(),
                pickColor(cfg.getColors()));
        f.clampInto(world.getBounds());
        world.getFood().add(f);
    }

    private List<Integer> pickColor(List<List<Integer>> colors) {
        if (colors == null || colors.isEmpty()) {
            return List.of(255, 255, 255);
        }
        return colors.get(random.nextInt(colors.size()));
    }

    private GameStateSnapshot buildSnapshot(long now) {
        Map<Integer, GameStateSnapshot.PlayerView> players = new LinkedHashMap<>();
        for (PlayerEntity p : world.getPlayers().values()) {
            if (!p.isAlive()) {
                continue;
            }
            Map<String, GameStateSnapshot.SkillView> skills = new LinkedHashMap<>();
            p.getSkills().forEach((name, skill) -> skills.put(name,
                    new GameStateSnapshot.SkillView(skill.isActive(), skill.effectiveRadius(p.getRadius()))));
            Double health = p.getSurvivalStats() != null ? p.getSurvivalStats().health : null;
            players.put(p.getId(), new GameStateSnapshot.PlayerView(
                    p.getId(), p.getName(), p.getX(), p.getY(), p.getRadius(), p.getScore(),
                    p.getColor(), health, skills));
        }

        List<GameStateSnapshot.FoodView> food = new ArrayList<>(world.getFood().size());
        for (FoodEntity f : world.getFood()) {
            food.add(new GameStateSnapshot.FoodView(f.getId(), f.getX(), f.getY(), f.getRadius(),
                    f.getType(), f.getValue(), f.getColor()));
        }
        return new GameStateSnapshot(world.getCurrentTick(), now, players, food);
    }

    // ==================== 查询 ====================

    public GameWorld getWorld() {
        return world;
    }

    public int getPlayerCount() {
        ReentrantLock lock = world.getLock();
        lock.lock();
        try {
            return world.getPlayers().size();
        } finally {
            lock.unlock();
        }
    }

    public int getTickRate() {
        return properties.getServer().getTickRate();
    }

    public double getDeltaTime() {
        return deltaTime;
    }
}
