package org.gridroute.routing.core;

/**
 * Public route service contract.
 *
 * <p>Implementations are expected to perform deterministic input validation and
 * throw reason-coded runtime exceptions for contract failures.</p>
 */
public interface RouterService {
    /**
     * Executes one point-to-point route request.
     *
     * @param request client route request.
     * @return route response for the requested start/goal pair.
     */
    RouteResponse route(RouteRequest request);
}
