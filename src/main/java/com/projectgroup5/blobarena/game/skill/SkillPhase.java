package com.projectgroup5.blobarena.game.skill;

public enum SkillPhase {
    IDLE,
    ACTIVE,
    COOLDOWN
}
