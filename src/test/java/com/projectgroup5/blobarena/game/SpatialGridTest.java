package com.projectgroup5.blobarena.game;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SpatialGridTest {

    private static FoodEntity food(long id, double x, double y) {
        return new FoodEntity(id, x, y, 5, 1, List.of(0, 0, 0));
    }

    @Test
    void query_returnsEntitiesInNearbyCellsOnly() {
        SpatialGrid<FoodEntity> grid = new SpatialGrid<>(50);
        FoodEntity near = food(1, 110, 110);
        FoodEntity far = food(2, 700, 500);
        grid.insertAll(List.of(near, far));

        assertThat(grid.query(100, 100, 30)).containsExactly(near);
        assertThat(grid.query(690, 490, 20)).containsExactly(far);
        assertThat(grid.query(400, 300, 10)).isEmpty();
    }

    @Test
    void query_ordersResultsRowMajor() {
        SpatialGrid<FoodEntity> grid = new SpatialGrid<>(10);
        FoodEntity bottomRight = food(1, 25, 25);
        FoodEntity topLeft = food(2, 5, 5);
        FoodEntity topRight = food(3, 25, 5);
        grid.insertAll(List.of(bottomRight, topLeft, topRight));

        assertThat(grid.query(15, 15, 15)).containsExactly(topLeft, topRight, bottomRight);
    }

    @Test
    void query_handlesNegativeCoordinates() {
        SpatialGrid<FoodEntity> grid = new SpatialGrid<>(20);
        FoodEntity f = food(1, -15, -15);
        grid.insert(f);

        assertThat(grid.query(-10, -10, 10)).containsExactly(f);
        assertThat(grid.cellCount()).isEqualTo(1);

        grid.clear();
        assertThat(grid.query(-10, -10, 10)).isEmpty();
    }

    @Test
    void constructor_rejectsNonPositiveCellSize() {
        assertThatThrownBy(() -> new SpatialGrid<FoodEntity>(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
