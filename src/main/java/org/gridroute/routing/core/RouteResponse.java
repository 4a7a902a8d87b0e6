package org.gridroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.gridroute.grid.Coordinate;
import org.gridroute.routing.heuristic.HeuristicType;
import org.gridroute.routing.search.SearchMode;

import java.util.List;

/**
 * Client-facing point-to-point route response.
 *
 * <p>When {@code reachable=false}, {@code path} and {@code obstacleCells} are empty and
 * {@code steps} is {@code -1}.</p>
 */
@Value
@Builder
public class RouteResponse {
    /** Whether a route was found from start to goal. */
    boolean reachable;
    /** Mode that produced this response. */
    SearchMode mode;
    /** Heuristic type that was bound during the search. */
    HeuristicType heuristicType;
    /** Number of moves on the route. */
    int steps;
    /** Number of obstacle cells on the route. */
    int obstaclesCrossed;
    /** Number of frontier pops. */
    int expandedNodes;
    /** Number of closed nodes re-opened under an improved key. */
    int reopenedNodes;
    /** Cells from start to goal inclusive. */
    @Singular("pathCell")
    List<Coordinate> path;
    /** Obstacle cells traversed, in route order. */
    @Singular("obstacleCell")
    List<Coordinate> obstacleCells;
}
