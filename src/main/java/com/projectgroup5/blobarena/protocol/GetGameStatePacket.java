package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GetGameStatePacket(@JsonProperty("full_update") boolean fullUpdate,
                                 @JsonProperty("last_ack") long lastAck) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.GET_GAME_STATE;
    }
}
