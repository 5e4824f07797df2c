package com.projectgroup5.blobarena.game;

import java.util.List;

/**
 * 食物实体
 */
public class FoodEntity extends Entity {
    public static final String TYPE_NORMAL = "normal";

    private final long id;
    private final int value;
    private final String type;

    public FoodEntity(long id, double x, double y, double radius, int value, List<Integer> color) {
        super(x, y, radius, color);
        this.id = id;
        this.value = value;
        this.type = TYPE_NORMAL;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.FOOD;
    }

    public long getId() {
        return id;
    }

    public int getValue() {
        return value;
    }

    public String getType() {
        return type;
    }

    @Override
    public String toString() {
        return "Food(id=" + id + ", x=" + x + ", y=" + y + ", value=" + value + ")";
    }
}
