package com.projectgroup5.blobarena.game;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.skill.Skill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 物理引擎 - 处理移动、技能和碰撞（服务器权威）
 * 所有方法都要求调用方已持有世界锁
 */
@Component
public class PhysicsEngine {
    private static final Logger logger = LoggerFactory.getLogger(PhysicsEngine.class);

    private final GameProperties.Player playerCfg;

    public PhysicsEngine(GameProperties properties) {
        this.playerCfg = properties.getPlayer();
    }

    /**
     * 1. 应用移动意图：position += dir * speed * dt，然后限制在边界内
     */
    public void applyIntents(GameWorld world, double deltaSeconds) {
        WorldBounds bounds = world.getBounds();
        for (PlayerEntity player : world.getPlayers().values()) {
            if (!player.isAlive()) {
                continue;
            }
            double[] dir = player.consumeIntent();
            double step = player.speed() * deltaSeconds;
            player.moveBy(dir[0] * step, dir[1] * step);
            player.clampInto(bounds);
        }
    }

    /**
     * 2. 技能结算：先推进状态机，仍在生效的技能作用于范围内的其他玩家和食物
     */
    public void resolveSkills(GameWorld world, long now) {
        WorldBounds bounds = world.getBounds();
        List<PlayerEntity> alive = world.getAlivePlayers();

        for (PlayerEntity caster : alive) {
            for (Skill skill : caster.getSkills().values()) {
                skill.update(now);
                if (!skill.isActive()) {
                    continue;
                }
                double effectiveRadius = skill.effectiveRadius(caster.getRadius());

                for (PlayerEntity target : alive) {
                    if (target == caster) {
                        continue;
                    }
                    if (inSkillRange(caster, target, effectiveRadius)) {
                        skill.applyTo(caster, target, bounds);
                    }
                }
                for (FoodEntity food : world.getFood()) {
                    if (inSkillRange(caster, food, effectiveRadius)) {
                        skill.applyTo(caster, food, bounds);
                    }
                }
            }
        }
    }

    /**
     * 3. 玩家吃食物（网格粗筛 + 圆形碰撞），每个食物最多被吃一次
     *
     * @return 被吃掉的食物数量
     */
    public int consumeFood(GameWorld world) {
        List<FoodEntity> food = world.getFood();
        if (food.isEmpty()) {
            return 0;
        }

        double maxFoodRadius = 0;
        for (FoodEntity f : food) {
            maxFoodRadius = Math.max(maxFoodRadius, f.getRadius());
        }
        SpatialGrid<FoodEntity> grid = new SpatialGrid<>(Math.max(playerCfg.getBaseRadius(), maxFoodRadius) * 2);
        grid.insertAll(food);

        Set<Long> eaten = new HashSet<>();
        for (PlayerEntity player : world.getPlayers().values()) {
            if (!player.isAlive()) {
                continue;
            }
            for (FoodEntity f : grid.query(player.getX(), player.getY(), player.getRadius() + maxFoodRadius)) {
                if (eaten.contains(f.getId())) {
                    continue;
                }
                if (checkCircleCollision(player.getX(), player.getY(), player.getRadius(),
                        f.getX(), f.getY(), f.getRadius())) {
                    eaten.add(f.getId());
                    player.addScore(f.getValue());
                    logger.debug("Player {} ate food {}, score={}", player.getName(), f.getId(), player.getScore());
                }
            }
        }

        if (!eaten.isEmpty()) {
            Iterator<FoodEntity> it = food.iterator();
            while (it.hasNext()) {
                if (eaten.contains(it.next().getId())) {
                    it.remove();
                }
            }
        }
        return eaten.size();
    }

    /**
     * 4. 玩家互吃：半径在本步开始时固定；
     * 每个被吃者只结算一次，由范围内最大的合格吞噬者吃掉
     */
    public List<EatEvent> resolvePlayerCollisions(GameWorld world, long now) {
        List<PlayerEntity> alive = world.getAlivePlayers();
        List<EatEvent> events = new ArrayList<>();
        if (alive.size() < 2) {
            return events;
        }

        Map<Integer, Double> radii = new HashMap<>();
        for (PlayerEntity p : alive) {
            radii.put(p.getId(), p.getRadius());
        }
        Comparator<PlayerEntity> bySize = Comparator
                .comparingDouble((PlayerEntity p) -> radii.get(p.getId()))
                .thenComparingInt(PlayerEntity::getId);

        List<PlayerEntity> victims = new ArrayList<>(alive);
        victims.sort(bySize);

        Set<Integer> dead = new HashSet<>();
        long respawnAt = now + playerCfg.getRespawnCooldown().toMillis();

        for (PlayerEntity victim : victims) {
            double victimRadius = radii.get(victim.getId());
            PlayerEntity eater = null;
            double eaterRadius = 0;
            for (PlayerEntity candidate : alive) {
                if (candidate == victim || dead.contains(candidate.getId())) {
                    continue;
                }
                double r = radii.get(candidate.getId());
                if (r < victimRadius * playerCfg.getEatRatio()) {
                    continue;
                }
                if (!checkCircleCollision(candidate.getX(), candidate.getY(), r,
                        victim.getX(), victim.getY(), victimRadius)) {
                    continue;
                }
                if (eater == null || r > eaterRadius || (r == eaterRadius && candidate.getId() < eater.getId())) {
                    eater = candidate;
                    eaterRadius = r;
                }
            }
            if (eater == null) {
                continue;
            }

            long reward = (long) Math.floor(victim.getScore() * playerCfg.getEatScoreFactor()) + playerCfg.getEatBonus();
            eater.addScore(reward);
            victim.kill(respawnAt);
            dead.add(victim.getId());
            events.add(new EatEvent(eater.getId(), victim.getId(), reward));
            logger.info("Player {} ate {} (+{} points)", eater.getName(), victim.getName(), reward);
        }
        return events;
    }

    /**
     * 非有限坐标（NaN/Infinity）重置到世界中心
     */
    public void sanitize(GameWorld world) {
        WorldBounds bounds = world.getBounds();
        for (PlayerEntity p : world.getPlayers().values()) {
            if (!Double.isFinite(p.getX()) || !Double.isFinite(p.getY())) {
                logger.warn("Player {} had a non-finite position, resetting", p.getName());
                p.setPosition(bounds.getCenterX(), bounds.getCenterY());
            }
        }
        for (FoodEntity f : world.getFood()) {
            if (!Double.isFinite(f.getX()) || !Double.isFinite(f.getY())) {
                f.setPosition(bounds.getCenterX(), bounds.getCenterY());
            }
        }
    }

    // 目标圆与技能范围有重叠
    private boolean inSkillRange(PlayerEntity caster, Entity target, double effectiveRadius) {
        return checkCircleCollision(caster.getX(), caster.getY(), effectiveRadius,
                target.getX(), target.getY(), target.getRadius());
    }

    /**
     * 圆形碰撞检测（相切也算碰撞）
     */
    private boolean checkCircleCollision(double x1, double y1, double r1,
                                         double x2, double y2, double r2) {
        double dx = x1 - x2;
        double dy = y1 - y2;
        double distance = Math.sqrt(dx * dx + dy * dy);
        return distance <= (r1 + r2);
    }
}
