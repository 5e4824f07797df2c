package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 协议包（封闭集合），JSON 中用 "type" 字段区分
 * 字段名即线上字段名，新增包类型时同时修改 {@link PacketType}
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConnectPacket.class, name = "connect"),
        @JsonSubTypes.Type(value = MovePacket.class, name = "move"),
        @JsonSubTypes.Type(value = SkillPacket.class, name = "skill"),
        @JsonSubTypes.Type(value = GetGameStatePacket.class, name = "get_game_state"),
        @JsonSubTypes.Type(value = PingPacket.class, name = "ping"),
        @JsonSubTypes.Type(value = PongPacket.class, name = "pong"),
        @JsonSubTypes.Type(value = PlayerIdPacket.class, name = "player_id"),
        @JsonSubTypes.Type(value = GameStatePacket.class, name = "game_state"),
        @JsonSubTypes.Type(value = UsernameTakenPacket.class, name = "username_taken"),
        @JsonSubTypes.Type(value = ServerFullPacket.class, name = "server_full")
})
public sealed interface Packet permits ConnectPacket, MovePacket, SkillPacket, GetGameStatePacket,
        PingPacket, PongPacket, PlayerIdPacket, GameStatePacket, UsernameTakenPacket, ServerFullPacket {

    @JsonIgnore
    PacketType packetType();
}
