package com.projectgroup5.blobarena.game;

import java.util.Collection;
import java.util.Random;

/**
 * 出生点 / 食物位置搜索
 * 尝试次数有上限，找不到满足距离约束的位置时退回到最空旷的候选点
 */
public class SpawnLocator {
    private final WorldBounds bounds;
    private final double padding;
    private final Random random;

    public SpawnLocator(WorldBounds bounds, double padding, Random random) {
        this.bounds = bounds;
        this.padding = padding;
        this.random = random;
    }

    /**
     * 玩家出生点：与每个存活玩家的圆心距离至少 minDistance + 对方半径
     */
    public Point findPlayerSpawn(Collection<PlayerEntity> alive, double radius, double minDistance, int attempts) {
        Point best = null;
        double bestClearance = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < Math.max(1, attempts); i++) {
            Point candidate = randomPoint(radius);
            double clearance = clearance(candidate, alive, minDistance);
            if (clearance >= 0) {
                return candidate;
            }
            if (clearance > bestClearance) {
                bestClearance = clearance;
                best = candidate;
            }
        }
        return best;
    }

    /**
     * 食物位置：尽量和玩家保持 minDistance，失败时接受最后一个候选点
     */
    public Point findFoodSpot(Collection<PlayerEntity> alive, double radius, double minDistance, int attempts) {
        Point candidate = randomPoint(radius);
        for (int i = 1; i < Math.max(1, attempts); i++) {
            if (clearance(candidate, alive, minDistance) >= 0) {
                return candidate;
            }
            candidate = randomPoint(radius);
        }
        return candidate;
    }

    // 最小余量：< 0 表示离某个玩家太近
    private static double clearance(Point p, Collection<PlayerEntity> alive, double minDistance) {
        double min = Double.POSITIVE_INFINITY;
        for (PlayerEntity other : alive) {
            double d = other.distanceTo(p.x(), p.y()) - (minDistance + other.getRadius());
            min = Math.min(min, d);
        }
        return min;
    }

    private Point randomPoint(double radius) {
        double margin = padding + radius;
        return new Point(
                uniform(margin, bounds.getWidth() - margin, bounds.getWidth()),
                uniform(margin, bounds.getHeight() - margin, bounds.getHeight()));
    }

    private double uniform(double min, double max, double dimension) {
        if (max <= min) {
            return dimension / 2;
        }
        return min + random.nextDouble() * (max - min);
    }
}
