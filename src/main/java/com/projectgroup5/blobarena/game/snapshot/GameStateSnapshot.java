package com.projectgroup5.blobarena.game.snapshot;

import java.util.List;
import java.util.Map;

/**
 * 每帧生成的不可变世界快照，广播线程只读它，不接触实时状态
 */
public record GameStateSnapshot(long tick,
                                long timestamp,
                                Map<Integer, PlayerView> players,
                                List<FoodView> food) {

    public GameStateSnapshot {
        players = Map.copyOf(players);
        food = List.copyOf(food);
    }

    public static GameStateSnapshot empty(long timestamp) {
        return new GameStateSnapshot(0, timestamp, Map.of(), List.of());
    }

    /**
     * 玩家公开字段；技能只暴露是否生效和作用半径，不暴露计时器
     */
    public record PlayerView(int id,
                             String name,
                             double x,
                             double y,
                             double radius,
                             long score,
                             List<Integer> color,
                             Double health,
                             Map<String, SkillView> skills) {

        public PlayerView {
            color = List.copyOf(color);
            skills = Map.copyOf(skills);
        }
    }

    public record SkillView(boolean active, double radius) {
    }

    public record FoodView(long id,
                           double x,
                           double y,
                           double radius,
                           String type,
                           int value,
                           List<Integer> color) {

        public FoodView {
            color = List.copyOf(color);
        }
    }
}
