package com.projectgroup5.blobarena.protocol;

public record PingPacket(long timestamp, long sequence) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.PING;
    }
}
