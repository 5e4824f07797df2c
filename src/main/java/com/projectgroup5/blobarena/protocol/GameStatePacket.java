package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.projectgroup5.blobarena.game.snapshot.GameStateSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 每帧广播的世界状态
 */
public record GameStatePacket(Map<Integer, PlayerState> players,
                              List<FoodState> food,
                              @JsonProperty("server_tick") long serverTick,
                              long timestamp) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.GAME_STATE;
    }

    public record PlayerState(String name,
                              Position position,
                              double radius,
                              long score,
                              Double health,
                              List<Integer> color,
                              Map<String, SkillState> skills) {
    }

    public record SkillState(boolean active, double radius) {
    }

    public record FoodState(long id,
                            Position position,
                            String type,
                            int value,
                            double radius,
                            List<Integer> color) {
    }

    public static GameStatePacket from(GameStateSnapshot snapshot) {
        Map<Integer, PlayerState> players = new LinkedHashMap<>();
        snapshot.players().forEach((id, p) -> {
            Map<String, SkillState> skills = new LinkedHashMap<>();
            p.skills().forEach((name, s) -> skills.put(name, new SkillState(s.active(), s.radius())));
            players.put(id, new PlayerState(p.name(), new Position(p.x(), p.y()), p.radius(), p.score(),
                    p.health(), p.color(), skills));
        });

        List<FoodState> food = new ArrayList<>(snapshot.food().size());
        for (GameStateSnapshot.FoodView f : snapshot.food()) {
            food.add(new FoodState(f.id(), new Position(f.x(), f.y()), f.type(), f.value(), f.radius(), f.color()));
        }
        return new GameStatePacket(players, food, snapshot.tick(), snapshot.timestamp());
    }
}
