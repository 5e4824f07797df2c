package com.projectgroup5.blobarena.game.survival;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.GameWorld;
import com.projectgroup5.blobarena.game.PlayerEntity;
import com.projectgroup5.blobarena.game.TickHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 把生存系统挂到主循环上（game.survival.enabled=true 时才创建）
 * 只更新数值并在快照里暴露 health，不影响移动和死亡
 */
@Component
@ConditionalOnProperty(prefix = "game.survival", name = "enabled", havingValue = "true")
public class SurvivalTickHook implements TickHook {
    private static final Logger logger = LoggerFactory.getLogger(SurvivalTickHook.class);

    private final SurvivalSystem survivalSystem;

    public SurvivalTickHook(GameProperties properties) {
        this.survivalSystem = new SurvivalSystem(properties.getSurvival());
        logger.info("Survival subsystem enabled");
    }

    @Override
    public void onTick(GameWorld world, long now, double dt) {
        for (PlayerEntity player : world.getPlayers().values()) {
            SurvivalStats stats = player.getSurvivalStats();
            if (!player.isAlive() || stats == null) {
                continue;
            }
            survivalSystem.update(stats, dt, player.isMoving(), false, false);
        }
    }

    @Override
    public void onPlayerSpawned(PlayerEntity player) {
        if (player.getSurvivalStats() == null) {
            player.setSurvivalStats(new SurvivalStats());
        }
    }

    public SurvivalSystem getSurvivalSystem() {
        return survivalSystem;
    }
}
