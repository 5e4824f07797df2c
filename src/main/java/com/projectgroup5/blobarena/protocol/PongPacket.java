package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PongPacket(long timestamp,
                         long sequence,
                         @JsonProperty("server_time") long serverTime) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.PONG;
    }
}
