package com.projectgroup5.blobarena.game.skill;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.Entity;
import com.projectgroup5.blobarena.game.PlayerEntity;
import com.projectgroup5.blobarena.game.WorldBounds;

/**
 * 技能状态机：IDLE -> ACTIVE -> COOLDOWN -> IDLE
 * 时间全部由调用方传入（毫秒），方便测试
 */
public abstract class Skill {

    private final String name;
    private int level = 1;
    private final double baseRadius;
    private final double radiusPerLevel;
    private final double force;
    private final long durationMillis;
    private final long cooldownMillis;
    private final double sizeThresholdMultiplier;

    private boolean active;
    private boolean used;
    private long lastUsed;
    private long activationTime;

    protected Skill(String name, GameProperties.SkillSettings settings) {
        this.name = name;
        this.baseRadius = settings.getBaseRadius();
        this.radiusPerLevel = settings.getRadiusPerLevel();
        this.force = settings.getForce();
        this.durationMillis = settings.getDuration().toMillis();
        this.cooldownMillis = settings.getCooldown().toMillis();
        this.sizeThresholdMultiplier = settings.getSizeThresholdMultiplier();
    }

    /**
     * 尝试激活技能；距上次使用不足一个冷却时间时返回 false
     * 冷却比持续时间短时，冷却结束即可重新激活
     */
    public boolean activate(long now) {
        update(now);
        if (used && now - lastUsed < cooldownMillis) {
            return false;
        }
        active = true;
        used = true;
        activationTime = now;
        lastUsed = now;
        return true;
    }

    /**
     * 持续时间到了就进入冷却
     */
    public void update(long now) {
        if (active && now - activationTime >= durationMillis) {
            active = false;
        }
    }

    public SkillPhase phase(long now) {
        if (active) {
            return SkillPhase.ACTIVE;
        }
        if (used && now - lastUsed < cooldownMillis) {
            return SkillPhase.COOLDOWN;
        }
        return SkillPhase.IDLE;
    }

    public void reset() {
        active = false;
        used = false;
        lastUsed = 0;
        activationTime = 0;
    }

    public double effectiveRadius(double playerRadius) {
        return baseRadius + level * radiusPerLevel + playerRadius;
    }

    /**
     * 对范围内的一个目标施加技能效果
     *
     * @return 是否有实体被移动
     */
    public abstract boolean applyTo(PlayerEntity caster, Entity target, WorldBounds bounds);

    /**
     * 距离越近力越大，范围边缘衰减为 0
     */
    protected double scaledForce(double distance, double effectiveRadius) {
        if (effectiveRadius <= 0) {
            return 0;
        }
        return force * Math.max(0, 1 - distance / effectiveRadius);
    }

    protected boolean exceedsThreshold(PlayerEntity caster, Entity target) {
        return target.getRadius() > caster.getRadius() * sizeThresholdMultiplier;
    }

    public String getName() {
        return name;
    }

    public int getLevel() {
        return level;
    }

    public void setLevel(int level) {
        this.level = Math.max(1, level);
    }

    public double getForce() {
        return force;
    }

    public boolean isActive() {
        return active;
    }

    public long getLastUsed() {
        return lastUsed;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public long getCooldownMillis() {
        return cooldownMillis;
    }

    public double getSizeThresholdMultiplier() {
        return sizeThresholdMultiplier;
    }
}
