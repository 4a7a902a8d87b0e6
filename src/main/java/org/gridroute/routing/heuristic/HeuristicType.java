package org.gridroute.routing.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (uniform-cost ordering).</p>
 * <p>{@code CHEBYSHEV} uses king-move distance, admissible and consistent for 8-directional
 * unit-step movement.</p>
 */
public enum HeuristicType {
    NONE,
    CHEBYSHEV
}
