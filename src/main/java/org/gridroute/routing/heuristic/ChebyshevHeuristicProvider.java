package org.gridroute.routing.heuristic;

import org.gridroute.grid.Coordinate;
import org.gridroute.grid.Grid;

import java.util.Objects;

/**
 * Chebyshev (diagonal) distance heuristic provider.
 *
 * <p>With orthogonal and diagonal moves both costing one step, {@code max(|dx|, |dy|)} is
 * the exact obstacle-free distance, so it never overestimates and satisfies the triangle
 * inequality across every move.</p>
 */
public final class ChebyshevHeuristicProvider implements HeuristicProvider {
    private final Grid grid;

    /**
     * @param grid grid used for goal bound validation.
     */
    public ChebyshevHeuristicProvider(Grid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    /**
     * Pure two-point form of the estimate.
     */
    public static int distance(Coordinate a, Coordinate b) {
        return Math.max(Math.abs(a.x() - b.x()), Math.abs(a.y() - b.y()));
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.CHEBYSHEV;
    }

    @Override
    public GoalBoundHeuristic bindGoal(Coordinate goal) {
        validateGoal(grid, goal);
        int goalX = goal.x();
        int goalY = goal.y();
        return (x, y) -> Math.max(Math.abs(x - goalX), Math.abs(y - goalY));
    }

    static void validateGoal(Grid grid, Coordinate goal) {
        Objects.requireNonNull(goal, "goal");
        if (!grid.inBounds(goal)) {
            throw new IllegalArgumentException(
                    "goal out of bounds: " + goal + " [0, " + grid.side() + ")"
            );
        }
    }
}
