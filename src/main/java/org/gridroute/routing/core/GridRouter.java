package org.gridroute.routing.core;

import lombok.Builder;
import org.gridroute.grid.Grid;
import org.gridroute.routing.heuristic.GoalBoundHeuristic;
import org.gridroute.routing.heuristic.HeuristicConfigurationException;
import org.gridroute.routing.heuristic.HeuristicFactory;
import org.gridroute.routing.heuristic.HeuristicProvider;
import org.gridroute.routing.heuristic.HeuristicType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Routing entry point for one grid.
 *
 * <p>The facade applies deterministic request validation before any search starts.
 * Execution flow:</p>
 * <ul>
 * <li>Validate required request fields.</li>
 * <li>Resolve or lazily build the heuristic provider and bind it to the goal.</li>
 * <li>Delegate to {@link GridPathSearch}, which validates coordinates against the grid.</li>
 * <li>Map the engine outcome to a {@link RouteResponse}.</li>
 * </ul>
 *
 * <p>The router reads the grid on every call; mutate the grid only between calls.</p>
 */
public final class GridRouter implements RouterService {
    private static final Logger log = LoggerFactory.getLogger(GridRouter.class);

    public static final String REASON_ROUTE_REQUEST_REQUIRED = "GR_REQUEST_REQUIRED";
    public static final String REASON_HEURISTIC_REQUIRED = "GR_HEURISTIC_REQUIRED";
    public static final String REASON_HEURISTIC_CONFIGURATION_FAILED = "GR_HEURISTIC_CONFIGURATION_FAILED";

    private final Grid grid;
    private final GridPathSearch engine;
    private final Map<HeuristicType, HeuristicProvider> heuristicProviders = new EnumMap<>(HeuristicType.class);

    /**
     * Creates a router bound to one grid.
     *
     * @param grid grid to route on.
     * @param engine optional engine override (defaults to property-configured budgets).
     */
    @Builder
    public GridRouter(Grid grid, GridPathSearch engine) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.engine = engine == null ? new GridPathSearch() : engine;
    }

    /**
     * Executes one route request.
     *
     * @param request route request.
     * @return response with reachability, path and search telemetry.
     * @throws RouteSearchException when request contracts or engine guardrails fail.
     */
    @Override
    public RouteResponse route(RouteRequest request) {
        if (request == null) {
            throw new RouteSearchException(REASON_ROUTE_REQUEST_REQUIRED, "route request must be provided");
        }
        HeuristicType heuristicType = request.getHeuristicType();
        if (heuristicType == null) {
            throw new RouteSearchException(REASON_HEURISTIC_REQUIRED, "heuristicType must be specified");
        }

        SearchOutcome outcome;
        try {
            GoalBoundHeuristic heuristic = resolveGoalBoundHeuristic(request, heuristicType);
            outcome = engine.search(grid, request.getStart(), request.getGoal(), request.getMode(), heuristic);
        } catch (RouteSearchException ex) {
            if (ex.isEngineFault()) {
                log.warn("Search {} -> {} failed: {}", request.getStart(), request.getGoal(), ex.getMessage());
            } else {
                log.debug("Rejected route request {} -> {}: {}", request.getStart(), request.getGoal(), ex.getMessage());
            }
            throw ex;
        }

        RouteResponse.RouteResponseBuilder builder = RouteResponse.builder()
                .reachable(outcome.reachable())
                .mode(request.getMode())
                .heuristicType(heuristicType)
                .expandedNodes(outcome.expandedNodes())
                .reopenedNodes(outcome.reopenedNodes());

        if (!outcome.reachable()) {
            log.info("No obstacle-free route from {} to {} ({} expansions)",
                    request.getStart(), request.getGoal(), outcome.expandedNodes());
            return builder.steps(-1).obstaclesCrossed(0).build();
        }

        Route route = outcome.route();
        return builder
                .steps(route.steps())
                .obstaclesCrossed(route.obstaclesCrossed())
                .path(route.coordinates())
                .obstacleCells(route.obstacleCells())
                .build();
    }

    /**
     * Resolves a goal-bound heuristic for the current request.
     *
     * <p>Goal bounds are checked by the engine first so an out-of-range goal surfaces with
     * its own reason code rather than as a heuristic failure.</p>
     */
    private GoalBoundHeuristic resolveGoalBoundHeuristic(RouteRequest request, HeuristicType heuristicType) {
        if (request.getGoal() == null || !grid.inBounds(request.getGoal())) {
            // let the engine report the precise reason
            return (x, y) -> 0;
        }
        HeuristicProvider provider = heuristicProviders.computeIfAbsent(heuristicType, this::buildHeuristicProvider);
        return provider.bindGoal(request.getGoal());
    }

    private HeuristicProvider buildHeuristicProvider(HeuristicType heuristicType) {
        try {
            return HeuristicFactory.create(heuristicType, grid);
        } catch (HeuristicConfigurationException ex) {
            throw new RouteSearchException(
                    REASON_HEURISTIC_CONFIGURATION_FAILED,
                    "failed to initialize heuristic " + ex.heuristicType() + ": " + ex.getMessage(),
                    ex
            );
        }
    }
}
