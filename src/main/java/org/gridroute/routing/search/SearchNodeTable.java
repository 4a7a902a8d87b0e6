package org.gridroute.routing.search;

import org.gridroute.grid.Coordinate;
import org.gridroute.grid.Grid;
import org.gridroute.routing.heuristic.GoalBoundHeuristic;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-search node bookkeeping, one slot per grid cell.
 *
 * <p>Nodes are addressed by the grid's row-major cell index. Predecessors are stored as
 * indices rather than object references, so the predecessor graph carries no ownership
 * cycles and is discarded with the table.</p>
 *
 * <p>Invariant: a node has a recorded cost exactly when its membership is {@code OPEN} or
 * {@code CLOSED}. Heuristic values are computed eagerly for the bound goal and never change.</p>
 *
 * <p><strong>Thread Safety:</strong> NOT thread-safe; one table belongs to one search.</p>
 */
public final class SearchNodeTable {
    public static final int UNVISITED = -1;
    public static final int NO_PREDECESSOR = -1;

    private final Grid grid;
    private final int[] costFromStart;
    private final int[] obstaclesCrossed;
    private final int[] heuristic;
    private final int[] predecessor;
    private final NodeMembership[] membership;

    /**
     * Builds a fresh table for one search.
     *
     * @param grid grid being searched.
     * @param goalHeuristic estimator bound to this search's goal.
     */
    public SearchNodeTable(Grid grid, GoalBoundHeuristic goalHeuristic) {
        this.grid = Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(goalHeuristic, "goalHeuristic");

        int cellCount = grid.cellCount();
        this.costFromStart = new int[cellCount];
        this.obstaclesCrossed = new int[cellCount];
        this.heuristic = new int[cellCount];
        this.predecessor = new int[cellCount];
        this.membership = new NodeMembership[cellCount];

        Arrays.fill(costFromStart, UNVISITED);
        Arrays.fill(predecessor, NO_PREDECESSOR);
        Arrays.fill(membership, NodeMembership.UNSEEN);
        for (int node = 0; node < cellCount; node++) {
            int estimate = goalHeuristic.estimate(grid.xOf(node), grid.yOf(node));
            if (estimate < 0) {
                throw new IllegalArgumentException("heuristic returned negative estimate " + estimate
                        + " at " + grid.coordinateOf(node));
            }
            heuristic[node] = estimate;
        }
    }

    public Grid grid() {
        return grid;
    }

    public int size() {
        return costFromStart.length;
    }

    public int nodeOf(Coordinate coordinate) {
        return grid.indexOf(coordinate);
    }

    public Coordinate coordinateOf(int node) {
        return grid.coordinateOf(node);
    }

    public boolean isUnseen(int node) {
        return membership[node] == NodeMembership.UNSEEN;
    }

    public NodeMembership membership(int node) {
        return membership[node];
    }

    /**
     * Best known step count from the start, or {@link #UNVISITED}.
     */
    public int costFromStart(int node) {
        return costFromStart[node];
    }

    public int obstaclesCrossed(int node) {
        return obstaclesCrossed[node];
    }

    public int heuristic(int node) {
        return heuristic[node];
    }

    /**
     * A* priority {@code g + h}.
     *
     * @throws IllegalStateException if the node has no recorded cost.
     */
    public int fScore(int node) {
        int g = costFromStart[node];
        if (g == UNVISITED) {
            throw new IllegalStateException("node " + coordinateOf(node) + " has no recorded cost");
        }
        return g + heuristic[node];
    }

    public int predecessor(int node) {
        return predecessor[node];
    }

    /**
     * Records a new best key for a node. Membership is left to the {@link Frontier}.
     */
    public void record(int node, int cost, int obstacles, int predecessorNode) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative, got " + cost);
        }
        if (obstacles < 0) {
            throw new IllegalArgumentException("obstacles must be non-negative, got " + obstacles);
        }
        costFromStart[node] = cost;
        obstaclesCrossed[node] = obstacles;
        predecessor[node] = predecessorNode;
    }

    /**
     * Records the goal's final key and marks it closed.
     *
     * <p>The goal is settled the moment it is discovered and never enters the frontier.</p>
     */
    public void settleGoal(int node, int cost, int obstacles, int predecessorNode) {
        record(node, cost, obstacles, predecessorNode);
        membership[node] = NodeMembership.CLOSED;
    }

    void markOpen(int node) {
        if (costFromStart[node] == UNVISITED) {
            throw new IllegalStateException("cannot open " + coordinateOf(node) + " without a recorded cost");
        }
        membership[node] = NodeMembership.OPEN;
    }

    void markClosed(int node) {
        membership[node] = NodeMembership.CLOSED;
    }
}
