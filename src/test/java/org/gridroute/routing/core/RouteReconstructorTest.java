package org.gridroute.routing.core;

import org.gridroute.grid.Coordinate;
import org.gridroute.grid.Grid;
import org.gridroute.routing.heuristic.NullHeuristicProvider;
import org.gridroute.routing.search.SearchNodeTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("RouteReconstructor Tests")
class RouteReconstructorTest {

    private Grid grid;
    private SearchNodeTable nodes;

    @BeforeEach
    void setUp() {
        grid = Grid.withObstacles(3, Coordinate.of(1, 1));
        nodes = new SearchNodeTable(grid, new NullHeuristicProvider(grid).bindGoal(Coordinate.of(2, 2)));
    }

    @Test
    @DisplayName("Walks predecessors back to the start in forward order")
    void testReconstructsForwardOrder() {
        nodes.record(0, 0, 0, SearchNodeTable.NO_PREDECESSOR);
        nodes.record(4, 1, 1, 0);
        nodes.record(8, 2, 1, 4);

        Route route = RouteReconstructor.reconstruct(nodes, 0, 8);

        assertEquals(List.of(Coordinate.of(0, 0), Coordinate.of(1, 1), Coordinate.of(2, 2)), route.coordinates());
        assertEquals(List.of(Coordinate.of(1, 1)), route.obstacleCells());
        assertEquals(2, route.steps());
        assertEquals(1, route.obstaclesCrossed());
    }

    @Test
    @DisplayName("Chain that stops short of the start is reported")
    void testBrokenChain() {
        nodes.record(4, 1, 0, SearchNodeTable.NO_PREDECESSOR);
        nodes.record(8, 2, 0, 4);

        RouteSearchException ex = assertThrows(RouteSearchException.class,
                () -> RouteReconstructor.reconstruct(nodes, 0, 8));
        assertEquals(RouteReconstructor.REASON_PREDECESSOR_CHAIN_BROKEN, ex.getReasonCode());
    }

    @Test
    @DisplayName("Looping chain is reported instead of spinning")
    void testCycle() {
        nodes.record(5, 1, 0, 4);
        nodes.record(4, 2, 0, 5);
        nodes.record(8, 3, 0, 4);

        RouteSearchException ex = assertThrows(RouteSearchException.class,
                () -> RouteReconstructor.reconstruct(nodes, 0, 8));
        assertEquals(RouteReconstructor.REASON_PREDECESSOR_CYCLE, ex.getReasonCode());
    }
}
