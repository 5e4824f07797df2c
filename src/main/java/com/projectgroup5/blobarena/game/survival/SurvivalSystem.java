package com.projectgroup5.blobarena.game.survival;

import com.projectgroup5.blobarena.config.GameProperties;

/**
 * 服务器权威的生存逻辑，按固定步长调用 update()
 * 不影响移动速度和死亡判定
 */
public class SurvivalSystem {

    private final GameProperties.Survival cfg;

    public SurvivalSystem(GameProperties.Survival cfg) {
        this.cfg = cfg;
    }

    public void update(SurvivalStats stats, double dt, boolean moving, boolean sprinting, boolean crafting) {
        double mult = 1.0;
        if (moving) mult *= cfg.getMoveMult();
        if (sprinting) mult *= cfg.getSprintMult();
        if (crafting) mult *= cfg.getCraftingMult();

        stats.calories -= cfg.getCaloriesDrainIdle() * mult * dt;
        stats.hydration -= cfg.getHydrationDrainIdle() * mult * dt;

        // 饥饿 / 脱水
        if (stats.calories <= 0.0) {
            stats.health -= cfg.getStarveHpLoss() * dt;
        }
        if (stats.hydration <= 0.0) {
            stats.health -= cfg.getDehydrateHpLoss() * dt;
        }

        // 出血
        if (stats.bleeding) {
            stats.blood -= cfg.getBleedLossPerSec() * dt;
        }
        if (stats.blood < cfg.getLowBloodThreshold()) {
            stats.health -= cfg.getLowBloodHpLoss() * dt;
        }

        if (stats.infection) {
            stats.health -= cfg.getInfectionHpLoss() * dt;
        }

        // 体温
        if (stats.temperature < cfg.getHypothermiaThreshold()) {
            stats.health -= cfg.getHypothermiaHpLoss() * dt;
        } else if (stats.temperature > cfg.getHeatstrokeThreshold()) {
            stats.hydration -= cfg.getHeatstrokeHydrationDrain() * dt;
        }

        stats.clamp(cfg);
    }

    public void eat(SurvivalStats stats, double kcal) {
        stats.calories += Math.max(0.0, kcal);
        stats.clamp(cfg);
    }

    public void drink(SurvivalStats stats, double amount) {
        stats.hydration += Math.max(0.0, amount);
        stats.clamp(cfg);
    }

    public void takeDamage(SurvivalStats stats, double hp) {
        stats.health -= Math.max(0.0, hp);
        stats.clamp(cfg);
    }

    public void setBleeding(SurvivalStats stats, boolean on) {
        stats.bleeding = on;
    }

    public void bandage(SurvivalStats stats) {
        stats.bleeding = false;
    }

    public void transfuse(SurvivalStats stats, double amount) {
        stats.blood += Math.max(0.0, amount);
        stats.clamp(cfg);
    }

    public void setInfection(SurvivalStats stats, boolean on) {
        stats.infection = on;
    }

    public void setTemperature(SurvivalStats stats, double celsius) {
        stats.temperature = celsius;
    }
}
