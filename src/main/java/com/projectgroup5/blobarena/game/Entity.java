package com.projectgroup5.blobarena.game;

import java.util.List;

/**
 * 圆形实体基类：位置、半径、颜色
 * 只包含几何辅助方法，不包含游戏规则
 */
public abstract class Entity {
    static final double MIN_RADIUS = 1.0;

    protected double x;
    protected double y;
    protected double radius;
    protected final List<Integer> color;

    protected Entity(double x, double y, double radius, List<Integer> color) {
        this.x = x;
        this.y = y;
        this.radius = Math.max(MIN_RADIUS, radius);
        this.color = List.copyOf(color);
    }

    public abstract EntityKind kind();

    public double distanceTo(Entity other) {
        return distanceTo(other.x, other.y);
    }

    public double distanceTo(double px, double py) {
        double dx = x - px;
        double dy = y - py;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * 圆形碰撞：圆心距离不超过半径之和
     */
    public boolean overlaps(Entity other) {
        return distanceTo(other) <= radius + other.radius;
    }

    public void clampInto(WorldBounds bounds) {
        x = bounds.clampX(x, radius);
        y = bounds.clampY(y, radius);
    }

    public void moveBy(double dx, double dy) {
        x += dx;
        y += dy;
    }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getRadius() {
        return radius;
    }

    public List<Integer> getColor() {
        return color;
    }
}
