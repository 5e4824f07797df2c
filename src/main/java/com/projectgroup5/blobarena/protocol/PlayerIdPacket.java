package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 握手成功的应答
 */
public record PlayerIdPacket(@JsonProperty("player_id") int playerId,
                             @JsonProperty("spawn_position") Position spawnPosition,
                             @JsonProperty("server_tick_rate") int serverTickRate) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.PLAYER_ID;
    }
}
