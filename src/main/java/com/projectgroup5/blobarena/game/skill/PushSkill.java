package com.projectgroup5.blobarena.game.skill;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.Entity;
import com.projectgroup5.blobarena.game.PlayerEntity;
import com.projectgroup5.blobarena.game.WorldBounds;

/**
 * 推开技能；目标过大时反作用在施放者身上
 */
public class PushSkill extends Skill {
    public static final String NAME = "push";

    public PushSkill(GameProperties.SkillSettings settings) {
        super(NAME, settings);
    }

    @Override
    public boolean applyTo(PlayerEntity caster, Entity target, WorldBounds bounds) {
        double dx = target.getX() - caster.getX();
        double dy = target.getY() - caster.getY();
        double distance = Math.max(1, Math.sqrt(dx * dx + dy * dy));
        double scale = scaledForce(distance, effectiveRadius(caster.getRadius()));
        if (scale <= 0) {
            return false;
        }

        if (exceedsThreshold(caster, target)) {
            caster.moveBy(-dx / distance * scale, -dy / distance * scale);
            caster.clampInto(bounds);
        } else {
            target.moveBy(dx / distance * scale, dy / distance * scale);
            target.clampInto(bounds);
        }
        return true;
    }
}
