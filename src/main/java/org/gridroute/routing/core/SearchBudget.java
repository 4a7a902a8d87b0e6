package org.gridroute.routing.core;

/**
 * Deterministic bound on node expansions per search.
 *
 * <p>The default cap is {@code cellCount * expansionFactor}, which leaves room for nodes
 * re-opened under the relaxed-mode key. Breaching the cap is a fatal configuration error,
 * not a not-found outcome.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final int DEFAULT_EXPANSION_FACTOR = 8;

    public static final String REASON_EXPANSIONS_EXCEEDED = "GR_SEARCH_BUDGET_EXCEEDED";

    static final String PROP_MAX_EXPANSIONS = "gridroute.search.maxExpansions";
    static final String PROP_EXPANSION_FACTOR = "gridroute.search.expansionFactor";

    private final int maxExpansions;
    private final int expansionFactor;

    private SearchBudget(int maxExpansions, int expansionFactor) {
        this.maxExpansions = maxExpansions <= 0 ? 0 : maxExpansions;
        this.expansionFactor = expansionFactor <= 0 ? DEFAULT_EXPANSION_FACTOR : expansionFactor;
    }

    /**
     * Budget with an absolute expansion cap. Non-positive values fall back to the
     * grid-relative default.
     */
    public static SearchBudget ofMaxExpansions(int maxExpansions) {
        return new SearchBudget(maxExpansions, DEFAULT_EXPANSION_FACTOR);
    }

    /**
     * Budget scaled by grid size.
     */
    public static SearchBudget ofExpansionFactor(int expansionFactor) {
        return new SearchBudget(0, expansionFactor);
    }

    /**
     * Budget that never trips.
     */
    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED, DEFAULT_EXPANSION_FACTOR);
    }

    /**
     * Loads budget values from system properties.
     */
    public static SearchBudget defaults() {
        return new SearchBudget(readInt(PROP_MAX_EXPANSIONS), readInt(PROP_EXPANSION_FACTOR));
    }

    /**
     * Resolves the effective cap for a grid with {@code cellCount} cells.
     */
    public int limitFor(int cellCount) {
        if (maxExpansions > 0) {
            return maxExpansions;
        }
        long scaled = (long) cellCount * expansionFactor;
        return scaled >= UNBOUNDED ? UNBOUNDED : (int) scaled;
    }

    /**
     * Validates the running expansion count against a resolved cap.
     *
     * @throws RouteSearchException with {@link #REASON_EXPANSIONS_EXCEEDED} when breached.
     */
    void checkExpansions(int expanded, int limit) {
        if (expanded > limit) {
            throw new RouteSearchException(
                    REASON_EXPANSIONS_EXCEEDED,
                    "expansion budget exceeded: " + expanded + " > " + limit
            );
        }
    }

    private static int readInt(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    @Override
    public String toString() {
        return maxExpansions > 0
                ? "SearchBudget{maxExpansions=" + maxExpansions + '}'
                : "SearchBudget{expansionFactor=" + expansionFactor + '}';
    }
}
