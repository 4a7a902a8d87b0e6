package org.gridroute.routing.core;

import java.util.Optional;

/**
 * Result of one engine run.
 *
 * @param status terminal state, {@link SearchStatus#GOAL_REACHED} or {@link SearchStatus#EXHAUSTED}.
 * @param route reconstructed route, {@code null} when exhausted.
 * @param expandedNodes number of frontier pops.
 * @param reopenedNodes number of closed nodes whose key later improved.
 * @param peakFrontierSize high-water mark of the frontier.
 */
public record SearchOutcome(
        SearchStatus status,
        Route route,
        int expandedNodes,
        int reopenedNodes,
        int peakFrontierSize
) {
    /**
     * Creates a canonical not-found outcome.
     */
    static SearchOutcome exhausted(int expandedNodes, int reopenedNodes, int peakFrontierSize) {
        return new SearchOutcome(SearchStatus.EXHAUSTED, null, expandedNodes, reopenedNodes, peakFrontierSize);
    }

    public boolean reachable() {
        return status == SearchStatus.GOAL_REACHED;
    }

    public Optional<Route> findRoute() {
        return Optional.ofNullable(route);
    }
}
