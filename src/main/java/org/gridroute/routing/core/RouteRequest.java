package org.gridroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.gridroute.grid.Coordinate;
import org.gridroute.routing.heuristic.HeuristicType;
import org.gridroute.routing.search.SearchMode;

/**
 * Client-facing point-to-point route request.
 */
@Value
@Builder
public class RouteRequest {
    /** Route origin cell. */
    Coordinate start;
    /** Route destination cell. */
    Coordinate goal;
    /** Obstacle semantics. */
    SearchMode mode;
    /** Heuristic mode to use; defaults to {@link HeuristicType#CHEBYSHEV}. */
    @Builder.Default
    HeuristicType heuristicType = HeuristicType.CHEBYSHEV;
}
