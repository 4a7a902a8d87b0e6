package org.gridroute.routing.search;

/**
 * Search-set membership of one node.
 */
public enum NodeMembership {
    /** Not reached yet; no cost recorded. */
    UNSEEN,
    /** In the frontier awaiting expansion. */
    OPEN,
    /** Expanded. May return to {@link #OPEN} if a better (obstacles, cost) key is found later. */
    CLOSED
}
