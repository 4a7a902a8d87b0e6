package org.gridroute.routing.core;

import org.gridroute.grid.Coordinate;
import org.gridroute.grid.Grid;
import org.gridroute.routing.heuristic.ChebyshevHeuristicProvider;
import org.gridroute.routing.heuristic.GoalBoundHeuristic;
import org.gridroute.routing.search.Frontier;
import org.gridroute.routing.search.NodeMembership;
import org.gridroute.routing.search.SearchMode;
import org.gridroute.routing.search.SearchNodeTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Best-first search over an 8-connected grid.
 *
 * <p>One engine serves both modes:</p>
 * <ul>
 * <li>{@link SearchMode#STRICT}: obstacles are skipped, frontier order is {@code g + h}.</li>
 * <li>{@link SearchMode#RELAXED}: obstacles cost one crossing each, frontier order is
 * {@code (crossings, g + h)} and the result crosses the fewest obstacles possible, then takes
 * the fewest steps among those routes.</li>
 * </ul>
 *
 * <p>A neighbor is relaxed when it is unseen, when the candidate crosses fewer obstacles, or
 * when it crosses as many and takes fewer steps. Closed nodes are NOT exempt: under the
 * compound key a node closed with one crossing count can still be improved, and it is then
 * re-opened. Skipping closed nodes, as textbook A* does, would break relaxed-mode optimality.</p>
 *
 * <p>The goal test runs when the goal is first generated as a neighbor. Every run builds its
 * own {@link SearchNodeTable} and {@link Frontier}; the engine itself holds no per-search state
 * and may be reused.</p>
 */
public final class GridPathSearch {
    private static final Logger log = LoggerFactory.getLogger(GridPathSearch.class);

    public static final String REASON_GRID_REQUIRED = "GR_GRID_REQUIRED";
    public static final String REASON_START_REQUIRED = "GR_START_REQUIRED";
    public static final String REASON_GOAL_REQUIRED = "GR_GOAL_REQUIRED";
    public static final String REASON_MODE_REQUIRED = "GR_MODE_REQUIRED";
    public static final String REASON_START_OUT_OF_BOUNDS = "GR_START_OUT_OF_BOUNDS";
    public static final String REASON_GOAL_OUT_OF_BOUNDS = "GR_GOAL_OUT_OF_BOUNDS";
    public static final String REASON_START_BLOCKED = "GR_START_BLOCKED";
    public static final String REASON_GOAL_BLOCKED = "GR_GOAL_BLOCKED";

    /**
     * Neighbor offsets in fixed enumeration order (x-major, then y). Changing the order changes
     * which of several equal routes is returned.
     */
    private static final int[][] NEIGHBOR_OFFSETS = {
            {-1, -1}, {-1, 0}, {-1, 1},
            {0, -1}, {0, 1},
            {1, -1}, {1, 0}, {1, 1}
    };

    private final SearchBudget budget;

    /**
     * Creates an engine with budgets loaded from system properties.
     */
    public GridPathSearch() {
        this(SearchBudget.defaults());
    }

    public GridPathSearch(SearchBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Searches with the Chebyshev heuristic bound to {@code goal}.
     *
     * @see #search(Grid, Coordinate, Coordinate, SearchMode, GoalBoundHeuristic)
     */
    public SearchOutcome search(Grid grid, Coordinate start, Coordinate goal, SearchMode mode) {
        validate(grid, start, goal, mode);
        return run(grid, start, goal, mode, new ChebyshevHeuristicProvider(grid).bindGoal(goal));
    }

    /**
     * Finds a route from {@code start} to {@code goal}.
     *
     * @param grid grid to search; must not be mutated during the call.
     * @param start start cell.
     * @param goal goal cell.
     * @param mode obstacle semantics.
     * @param heuristic admissible estimator bound to {@code goal}; one that is not consistent
     * makes the engine re-open closed nodes.
     * @return outcome with a route, or {@link SearchStatus#EXHAUSTED} when none exists.
     * @throws RouteSearchException for invalid input, a breached budget or a corrupted
     * predecessor chain.
     */
    public SearchOutcome search(
            Grid grid,
            Coordinate start,
            Coordinate goal,
            SearchMode mode,
            GoalBoundHeuristic heuristic
    ) {
        validate(grid, start, goal, mode);
        return run(grid, start, goal, mode, Objects.requireNonNull(heuristic, "heuristic"));
    }

    private SearchOutcome run(
            Grid grid,
            Coordinate start,
            Coordinate goal,
            SearchMode mode,
            GoalBoundHeuristic heuristic
    ) {
        SearchNodeTable nodes = new SearchNodeTable(grid, heuristic);
        int startNode = nodes.nodeOf(start);
        int goalNode = nodes.nodeOf(goal);
        int startObstacles = grid.passableAt(startNode) ? 0 : 1;

        log.debug("Searching {} -> {} on {} in {} mode", start, goal, grid, mode);

        if (startNode == goalNode) {
            nodes.settleGoal(goalNode, 0, startObstacles, SearchNodeTable.NO_PREDECESSOR);
            Route route = RouteReconstructor.reconstruct(nodes, startNode, goalNode);
            return new SearchOutcome(SearchStatus.GOAL_REACHED, route, 0, 0, 0);
        }

        Frontier frontier = new Frontier(nodes, mode);
        nodes.record(startNode, 0, startObstacles, SearchNodeTable.NO_PREDECESSOR);
        frontier.insertOrUpdate(startNode);

        int expansionLimit = budget.limitFor(grid.cellCount());
        int expanded = 0;
        int reopened = 0;
        SearchStatus status = SearchStatus.RUNNING;

        while (status == SearchStatus.RUNNING) {
            if (frontier.isEmpty()) {
                status = SearchStatus.EXHAUSTED;
                break;
            }

            int current = frontier.popBest();
            expanded++;
            budget.checkExpansions(expanded, expansionLimit);

            int currentX = grid.xOf(current);
            int currentY = grid.yOf(current);
            int currentCost = nodes.costFromStart(current);
            int currentObstacles = nodes.obstaclesCrossed(current);

            for (int[] offset : NEIGHBOR_OFFSETS) {
                int x = currentX + offset[0];
                int y = currentY + offset[1];
                if (!grid.inBounds(x, y)) {
                    continue;
                }
                int neighbor = grid.indexOf(x, y);
                boolean passable = grid.passableAt(neighbor);
                if (!passable && !mode.obstaclesPassable()) {
                    continue;
                }

                int newCost = currentCost + 1;
                int newObstacles = currentObstacles + (passable ? 0 : 1);

                if (neighbor == goalNode) {
                    nodes.settleGoal(goalNode, newCost, newObstacles, current);
                    status = SearchStatus.GOAL_REACHED;
                    break;
                }

                if (!improves(nodes, neighbor, newCost, newObstacles)) {
                    continue;
                }
                boolean reopening = nodes.membership(neighbor) == NodeMembership.CLOSED;
                nodes.record(neighbor, newCost, newObstacles, current);
                frontier.insertOrUpdate(neighbor);
                if (reopening) {
                    reopened++;
                    log.debug("Re-opened {} with {} crossings at cost {}", nodes.coordinateOf(neighbor), newObstacles, newCost);
                }
            }
        }

        log.debug("Search {} -> {} finished {} after {} expansions ({} re-opened, peak frontier {})",
                start, goal, status, expanded, reopened, frontier.getPeakSize());

        if (status == SearchStatus.EXHAUSTED) {
            return SearchOutcome.exhausted(expanded, reopened, frontier.getPeakSize());
        }
        Route route = RouteReconstructor.reconstruct(nodes, startNode, goalNode);
        return new SearchOutcome(status, route, expanded, reopened, frontier.getPeakSize());
    }

    /**
     * Relax condition on the lexicographic {@code (obstacles, cost)} key.
     *
     * <p>In strict mode every candidate carries the same crossing count, so this reduces to
     * "unseen or cheaper".</p>
     */
    private static boolean improves(SearchNodeTable nodes, int node, int newCost, int newObstacles) {
        if (nodes.isUnseen(node)) {
            return true;
        }
        int knownObstacles = nodes.obstaclesCrossed(node);
        if (newObstacles != knownObstacles) {
            return newObstacles < knownObstacles;
        }
        return newCost < nodes.costFromStart(node);
    }

    /**
     * Rejects inputs that make the search meaningless before any state is built.
     */
    private static void validate(Grid grid, Coordinate start, Coordinate goal, SearchMode mode) {
        if (grid == null) {
            throw new RouteSearchException(REASON_GRID_REQUIRED, "grid must be provided");
        }
        if (start == null) {
            throw new RouteSearchException(REASON_START_REQUIRED, "start must be provided");
        }
        if (goal == null) {
            throw new RouteSearchException(REASON_GOAL_REQUIRED, "goal must be provided");
        }
        if (mode == null) {
            throw new RouteSearchException(REASON_MODE_REQUIRED, "mode must be specified");
        }
        if (!grid.inBounds(start)) {
            throw new RouteSearchException(
                    REASON_START_OUT_OF_BOUNDS,
                    "start " + start + " outside [0, " + grid.side() + ")"
            );
        }
        if (!grid.inBounds(goal)) {
            throw new RouteSearchException(
                    REASON_GOAL_OUT_OF_BOUNDS,
                    "goal " + goal + " outside [0, " + grid.side() + ")"
            );
        }
        if (mode == SearchMode.STRICT) {
            if (!grid.passable(start)) {
                throw new RouteSearchException(REASON_START_BLOCKED, "start " + start + " is an obstacle");
            }
            if (!grid.passable(goal)) {
                throw new RouteSearchException(REASON_GOAL_BLOCKED, "goal " + goal + " is an obstacle");
            }
        }
    }
}
