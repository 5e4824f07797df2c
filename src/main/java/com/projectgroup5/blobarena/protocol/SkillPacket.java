package com.projectgroup5.blobarena.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SkillPacket(@JsonProperty("skill_name") String skillName,
                          @JsonProperty("target_x") Double targetX,
                          @JsonProperty("target_y") Double targetY,
                          Double direction) implements Packet {

    @Override
    public PacketType packetType() {
        return PacketType.SKILL;
    }
}
