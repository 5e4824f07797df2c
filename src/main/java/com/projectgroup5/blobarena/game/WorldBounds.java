package com.projectgroup5.blobarena.game;

/**
 * 世界边界（启动后不可变）
 */
public final class WorldBounds {
    private final double width;
    private final double height;

    public WorldBounds(double width, double height) {
        if (!(width > 0) || !(height > 0) || Double.isInfinite(width) || Double.isInfinite(height)) {
            throw new IllegalArgumentException("World size must be positive and finite: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getCenterX() {
        return width / 2;
    }

    public double getCenterY() {
        return height / 2;
    }

    public double clampX(double x, double radius) {
        return clamp(x, radius, width);
    }

    public double clampY(double y, double radius) {
        return clamp(y, radius, height);
    }

    // 实体比世界还大时放在中线上
    private static double clamp(double value, double radius, double dimension) {
        if (radius * 2 >= dimension) {
            return dimension / 2;
        }
        if (!Double.isFinite(value)) {
            return dimension / 2;
        }
        return Math.max(radius, Math.min(dimension - radius, value));
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
