package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConnectPacket(String name,
                            String version,
                            @JsonProperty("client_id") String clientId) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.CONNECT;
    }
}
