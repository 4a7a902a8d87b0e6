package org.gridroute.grid;

import lombok.experimental.UtilityClass;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * ASCII rendering of a grid with an optional route overlay.
 *
 * <p>Rows are printed top-down ({@code y = N-1} first) so that {@code (0,0)} sits in the
 * bottom-left corner.</p>
 */
@UtilityClass
public class GridRenderer {
    public static final char EMPTY = ' ';
    public static final char OBSTACLE = 'X';
    public static final char ROUTE = 'O';
    public static final char CROSSED_OBSTACLE = '+';

    /**
     * Renders the grid without any route.
     */
    public static String render(Grid grid) {
        return render(grid, List.of());
    }

    /**
     * Renders the grid, marking route cells with {@link #ROUTE} and obstacles on the route
     * with {@link #CROSSED_OBSTACLE}.
     */
    public static String render(Grid grid, List<Coordinate> route) {
        Objects.requireNonNull(grid, "grid");
        Set<Coordinate> onRoute = new HashSet<>(route == null ? List.of() : route);

        StringBuilder out = new StringBuilder(grid.cellCount() * 4 + grid.side());
        for (int y = grid.side() - 1; y >= 0; y--) {
            for (int x = 0; x < grid.side(); x++) {
                if (x > 0) {
                    out.append(' ');
                }
                out.append('[').append(symbolAt(grid, x, y, onRoute)).append(']');
            }
            out.append('\n');
        }
        return out.toString();
    }

    /**
     * Formats coordinates as {@code [(x,y),(x,y)]}.
     */
    public static String formatCoordinates(List<Coordinate> coordinates) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (Coordinate coordinate : coordinates) {
            joiner.add(coordinate.toString());
        }
        return joiner.toString();
    }

    private static char symbolAt(Grid grid, int x, int y, Set<Coordinate> onRoute) {
        boolean passable = grid.passable(x, y);
        if (onRoute.contains(new Coordinate(x, y))) {
            return passable ? ROUTE : CROSSED_OBSTACLE;
        }
        return passable ? EMPTY : OBSTACLE;
    }
}
