package com.projectgroup5.blobarena.protocol;

import java.util.List;

public record UsernameTakenPacket(String message, List<String> suggestions) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.USERNAME_TAKEN;
    }
}
