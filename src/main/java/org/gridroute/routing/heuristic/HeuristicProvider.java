package org.gridroute.routing.heuristic;

import org.gridroute.grid.Coordinate;

/**
 * Heuristic provider contract used by the grid search engine.
 *
 * <p>Providers are immutable. Binding returns an estimator fixed to one goal; estimates
 * computed against one goal are meaningless for another, so every search binds afresh.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal cell and returns a reusable estimator.
     *
     * @param goal goal cell (must lie inside the provider's grid).
     * @return immutable estimator bound to {@code goal}.
     */
    GoalBoundHeuristic bindGoal(Coordinate goal);
}
