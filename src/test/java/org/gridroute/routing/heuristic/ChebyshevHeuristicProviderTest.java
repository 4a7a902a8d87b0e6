package org.gridroute.routing.heuristic;

import org.gridroute.grid.Coordinate;
import org.gridroute.grid.Grid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Chebyshev Heuristic Tests")
class ChebyshevHeuristicProviderTest {

    @ParameterizedTest
    @CsvSource({
            "0,0, 0,0, 0",
            "0,0, 2,2, 2",
            "0,0, 9,3, 9",
            "7,1, 2,4, 5",
            "4,4, 4,0, 4"
    })
    @DisplayName("Distance is max(|dx|, |dy|)")
    void testDistance(int ax, int ay, int bx, int by, int expected) {
        assertEquals(expected, ChebyshevHeuristicProvider.distance(Coordinate.of(ax, ay), Coordinate.of(bx, by)));
        assertEquals(expected, ChebyshevHeuristicProvider.distance(Coordinate.of(bx, by), Coordinate.of(ax, ay)));
    }

    @Test
    @DisplayName("Bound estimator matches the two-point form")
    void testBoundMatchesPure() {
        Grid grid = new Grid(6);
        Coordinate goal = Coordinate.of(4, 1);
        GoalBoundHeuristic heuristic = new ChebyshevHeuristicProvider(grid).bindGoal(goal);
        for (int x = 0; x < 6; x++) {
            for (int y = 0; y < 6; y++) {
                assertEquals(ChebyshevHeuristicProvider.distance(Coordinate.of(x, y), goal), heuristic.estimate(x, y));
            }
        }
    }

    @Test
    @DisplayName("Consistency: estimate drops by at most one per move")
    void testConsistency() {
        Grid grid = new Grid(7);
        GoalBoundHeuristic heuristic = new ChebyshevHeuristicProvider(grid).bindGoal(Coordinate.of(5, 2));
        for (int x = 0; x < 7; x++) {
            for (int y = 0; y < 7; y++) {
                for (int dx = -1; dx <= 1; dx++) {
                    for (int dy = -1; dy <= 1; dy++) {
                        if (!grid.inBounds(x + dx, y + dy)) {
                            continue;
                        }
                        int drop = heuristic.estimate(x, y) - heuristic.estimate(x + dx, y + dy);
                        assertTrue(drop <= 1, "h must satisfy h(a) <= 1 + h(b) for neighbors");
                    }
                }
            }
        }
    }
}
