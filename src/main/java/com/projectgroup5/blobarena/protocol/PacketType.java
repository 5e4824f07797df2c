package com.projectgroup5.blobarena.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * 包类型判别值（线上 "type" 字段）
 */
public enum PacketType {
    CONNECT("connect", ConnectPacket.class, Direction.CLIENT_TO_SERVER),
    MOVE("move", MovePacket.class, Direction.CLIENT_TO_SERVER),
    SKILL("skill", SkillPacket.class, Direction.CLIENT_TO_SERVER),
    GET_GAME_STATE("get_game_state", GetGameStatePacket.class, Direction.CLIENT_TO_SERVER),
    PING("ping", PingPacket.class, Direction.BOTH),
    PONG("pong", PongPacket.class, Direction.BOTH),
    PLAYER_ID("player_id", PlayerIdPacket.class, Direction.SERVER_TO_CLIENT),
    GAME_STATE("game_state", GameStatePacket.class, Direction.SERVER_TO_CLIENT),
    USERNAME_TAKEN("username_taken", UsernameTakenPacket.class, Direction.SERVER_TO_CLIENT),
    SERVER_FULL("server_full", ServerFullPacket.class, Direction.SERVER_TO_CLIENT);

    public enum Direction {
        CLIENT_TO_SERVER,
        SERVER_TO_CLIENT,
        BOTH
    }

    private static final Map<String, PacketType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (PacketType t : values()) {
            BY_WIRE_NAME.put(t.wireName, t);
        }
    }

    private final String wireName;
    private final Class<? extends Packet> packetClass;
    private final Direction direction;

    PacketType(String wireName, Class<? extends Packet> packetClass, Direction direction) {
        this.wireName = wireName;
        this.packetClass = packetClass;
        this.direction = direction;
    }

    public static PacketType fromWireName(String wireName) {
        return BY_WIRE_NAME.get(wireName);
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends Packet> packetClass() {
        return packetClass;
    }

    public boolean acceptedByServer() {
        return direction != Direction.SERVER_TO_CLIENT;
    }
}
