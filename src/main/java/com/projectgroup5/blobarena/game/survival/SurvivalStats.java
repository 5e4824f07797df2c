package com.projectgroup5.blobarena.game.survival;

import com.projectgroup5.blobarena.config.GameProperties;

/**
 * 玩家生存数值
 */
public class SurvivalStats {
    public double health = 100.0;
    public double calories = 3000.0;
    public double hydration = 5000.0;
    public double blood = 5000.0;
    public boolean bleeding;
    public boolean infection;
    // 摄氏度
    public double temperature = 37.0;

    public void clamp(GameProperties.Survival cfg) {
        health = Math.max(0.0, Math.min(health, cfg.getMaxHealth()));
        calories = Math.max(0.0, Math.min(calories, cfg.getMaxCalories()));
        hydration = Math.max(0.0, Math.min(hydration, cfg.getMaxHydration()));
        blood = Math.max(0.0, Math.min(blood, cfg.getMaxBlood()));
    }
}
