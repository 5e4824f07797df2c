package com.projectgroup5.blobarena.game;

/**
 * 一次玩家吞噬事件
 */
public record EatEvent(int eaterId, int victimId, long reward) {
}
