package org.gridroute.routing.heuristic;

/**
 * Immutable goal-bound heuristic estimator.
 *
 * <p>Hot path contract: {@link #estimate(int, int)} must avoid allocations.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining steps from a cell to the pre-bound goal.
     *
     * @param x cell column.
     * @param y cell row.
     * @return admissible lower-bound estimate.
     */
    int estimate(int x, int y);
}
