package com.projectgroup5.blobarena.game;

public enum EntityKind {
    PLAYER,
    FOOD
}
