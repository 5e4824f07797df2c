package com.projectgroup5.blobarena.game;

/**
 * 每帧的可选扩展点，在食物补充之后、快照之前调用（已持有世界锁）
 */
public interface TickHook {

    void onTick(GameWorld world, long now, double dt);

    /**
     * 玩家加入或重生时调用
     */
    default void onPlayerSpawned(PlayerEntity player) {
    }
}
