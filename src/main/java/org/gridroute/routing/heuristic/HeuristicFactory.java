package org.gridroute.routing.heuristic;

import lombok.experimental.UtilityClass;
import org.gridroute.grid.Grid;

/**
 * Strict heuristic factory.
 *
 * <p>Centralizes validation so every provider is created against a concrete grid with
 * deterministic failure reason codes.</p>
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "GR_HEURISTIC_TYPE_REQUIRED";
    public static final String REASON_GRID_REQUIRED = "GR_HEURISTIC_GRID_REQUIRED";

    /**
     * Creates a heuristic provider.
     *
     * @param type requested heuristic type.
     * @param grid grid the provider validates goals against.
     * @return initialized heuristic provider.
     * @throws HeuristicConfigurationException if {@code type} or {@code grid} is missing.
     */
    public static HeuristicProvider create(HeuristicType type, Grid grid) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    null,
                    "heuristic type must be explicitly specified (NONE, CHEBYSHEV)"
            );
        }
        if (grid == null) {
            throw new HeuristicConfigurationException(REASON_GRID_REQUIRED, type, "grid must be provided");
        }
        return switch (type) {
            case NONE -> new NullHeuristicProvider(grid);
            case CHEBYSHEV -> new ChebyshevHeuristicProvider(grid);
        };
    }
}
