package org.gridroute.routing.search;

import java.util.Locale;

/**
 * Obstacle semantics of one search run.
 */
public enum SearchMode {
    /**
     * Obstacles are walls. Frontier order is the plain A* {@code f = g + h}.
     */
    STRICT(false),
    /**
     * Obstacles can be crossed at a penalty. Frontier order is lexicographic
     * {@code (obstaclesCrossed, f)}: fewer crossings always win, shorter routes break ties.
     */
    RELAXED(true);

    private final boolean obstaclesPassable;

    SearchMode(boolean obstaclesPassable) {
        this.obstaclesPassable = obstaclesPassable;
    }

    public boolean obstaclesPassable() {
        return obstaclesPassable;
    }

    /**
     * Case-insensitive lookup used by the CLI.
     *
     * @throws IllegalArgumentException for unknown names.
     */
    public static SearchMode parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("search mode must be non-blank");
        }
        return valueOf(name.strip().toUpperCase(Locale.ROOT));
    }
}
