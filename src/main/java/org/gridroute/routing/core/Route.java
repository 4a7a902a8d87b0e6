package org.gridroute.routing.core;

import org.gridroute.grid.Coordinate;

import java.util.List;
import java.util.Objects;

/**
 * Ordered route from start to goal, both inclusive.
 *
 * @param coordinates cells visited in order; never empty.
 * @param obstacleCells obstacle cells on the route, in route order.
 */
public record Route(List<Coordinate> coordinates, List<Coordinate> obstacleCells) {

    public Route {
        Objects.requireNonNull(coordinates, "coordinates");
        Objects.requireNonNull(obstacleCells, "obstacleCells");
        if (coordinates.isEmpty()) {
            throw new IllegalArgumentException("route must contain at least one coordinate");
        }
        coordinates = List.copyOf(coordinates);
        obstacleCells = List.copyOf(obstacleCells);
    }

    public Coordinate start() {
        return coordinates.get(0);
    }

    public Coordinate goal() {
        return coordinates.get(coordinates.size() - 1);
    }

    /**
     * Number of moves, {@code coordinates().size() - 1}.
     */
    public int steps() {
        return coordinates.size() - 1;
    }

    public int obstaclesCrossed() {
        return obstacleCells.size();
    }
}
