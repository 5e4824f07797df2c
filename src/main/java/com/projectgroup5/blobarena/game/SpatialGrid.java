package com.projectgroup5.blobarena.game;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 均匀网格空间索引，按圆心所在格子存放实体
 * 查询结果按格子行优先顺序返回，保证同一输入下结果顺序确定
 */
public class SpatialGrid<T extends Entity> {
    private final double cellSize;
    private final Map<Long, List<T>> cells = new HashMap<>();

    public SpatialGrid(double cellSize) {
        if (!(cellSize > 0)) {
            throw new IllegalArgumentException("cellSize must be positive: " + cellSize);
        }
        this.cellSize = cellSize;
    }

    public void insert(T entity) {
        cells.computeIfAbsent(key(cell(entity.getX()), cell(entity.getY())), k -> new ArrayList<>()).add(entity);
    }

    public void insertAll(Iterable<? extends T> entities) {
        for (T e : entities) {
            insert(e);
        }
    }

    /**
     * 返回圆心可能落在 (x, y) 周围 range 范围内的实体（粗筛，调用方再做精确判断）
     */
    public List<T> query(double x, double y, double range) {
        List<T> result = new ArrayList<>();
        int minCx = cell(x - range);
        int maxCx = cell(x + range);
        int minCy = cell(y - range);
        int maxCy = cell(y + range);
        for (int cy = minCy; cy <= maxCy; cy++) {
            for (int cx = minCx; cx <= maxCx; cx++) {
                List<T> bucket = cells.get(key(cx, cy));
                if (bucket != null) {
                    result.addAll(bucket);
                }
            }
        }
        return result;
    }

    public void clear() {
        cells.clear();
    }

    public int cellCount() {
        return cells.size();
    }

    private int cell(double coordinate) {
        return (int) Math.floor(coordinate / cellSize);
    }

    private static long key(int cx, int cy) {
        return ((long) cx << 32) | (cy & 0xffffffffL);
    }
}
