package org.gridroute.routing.core;

/**
 * States of one search run.
 */
public enum SearchStatus {
    RUNNING,
    GOAL_REACHED,
    /** Frontier drained before the goal was discovered. */
    EXHAUSTED
}
