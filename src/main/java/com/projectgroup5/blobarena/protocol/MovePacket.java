package com.projectgroup5.blobarena.protocol;

/**
 * 移动意图；sequence 单调递增，只用于丢弃过期包
 */
public record MovePacket(double dx, double dy, long sequence, long timestamp) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.MOVE;
    }
}
