package org.gridroute.routing.heuristic;

import org.gridroute.grid.Grid;
import org.gridroute.grid.Coordinate;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore behaves like plain uniform-cost search
 * while still honoring goal bound checks.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private static final GoalBoundHeuristic ZERO = (x, y) -> 0;

    private final Grid grid;

    public NullHeuristicProvider(Grid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(Coordinate goal) {
        ChebyshevHeuristicProvider.validateGoal(grid, goal);
        return ZERO;
    }
}
