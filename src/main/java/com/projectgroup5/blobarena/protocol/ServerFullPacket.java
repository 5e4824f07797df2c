package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ServerFullPacket(String message,
                               @JsonProperty("max_players") int maxPlayers,
                               @JsonProperty("queue_position") Integer queuePosition) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.SERVER_FULL;
    }
}
