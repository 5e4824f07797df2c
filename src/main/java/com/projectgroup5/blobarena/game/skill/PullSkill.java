package com.projectgroup5.blobarena.game.skill;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.Entity;
import com.projectgroup5.blobarena.game.PlayerEntity;
import com.projectgroup5.blobarena.game.WorldBounds;

/**
 * 拉近技能；目标过大时无效果
 */
public class PullSkill extends Skill {
    public static final String NAME = "pull";

    public PullSkill(GameProperties.SkillSettings settings) {
        super(NAME, settings);
    }

    @Override
    public boolean applyTo(PlayerEntity caster, Entity target, WorldBounds bounds) {
        if (exceedsThreshold(caster, target)) {
            return false;
        }
        double dx = target.getX() - caster.getX();
        double dy = target.getY() - caster.getY();
        double distance = Math.max(1, Math.sqrt(dx * dx + dy * dy));
        double scale = scaledForce(distance, effectiveRadius(caster.getRadius()));
        if (scale <= 0) {
            return false;
        }
        // 不能拉过头
        double step = Math.min(scale, Math.sqrt(dx * dx + dy * dy));
        target.moveBy(-dx / distance * step, -dy / distance * step);
        target.clampInto(bounds);
        return true;
    }
}
