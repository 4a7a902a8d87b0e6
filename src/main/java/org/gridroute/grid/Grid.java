package org.gridroute.grid;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Square {@code N x N} grid of cells with per-cell obstacle flags.
 *
 * <p>The side length is fixed at construction. Obstacle flags live in a {@link BitSet}
 * (one bit per cell, row-major by {@link #indexOf(int, int)}), so the grid stays compact
 * even for large sides.</p>
 *
 * <p><strong>Thread Safety:</strong> This class is NOT thread-safe. Obstacle placement is a
 * setup step; do not mutate a grid while a search over it is running.</p>
 */
public final class Grid {

    private final int side;
    private final BitSet obstacles;

    /**
     * Creates a fully passable grid.
     *
     * @param side number of cells per row and column.
     * @throws IllegalArgumentException if {@code side} is not positive or the cell count overflows.
     */
    public Grid(int side) {
        if (side <= 0) {
            throw new IllegalArgumentException("side must be positive, got " + side);
        }
        if ((long) side * side > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("side too large: " + side);
        }
        this.side = side;
        this.obstacles = new BitSet(side * side);
    }

    /**
     * Creates a grid with the given obstacle cells already placed.
     */
    public static Grid withObstacles(int side, Coordinate... obstacleCells) {
        Grid grid = new Grid(side);
        for (Coordinate cell : obstacleCells) {
            grid.placeObstacle(cell);
        }
        return grid;
    }

    public int side() {
        return side;
    }

    public int cellCount() {
        return side * side;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < side && y >= 0 && y < side;
    }

    public boolean inBounds(Coordinate coordinate) {
        return coordinate != null && inBounds(coordinate.x(), coordinate.y());
    }

    /**
     * Returns whether the cell at {@code (x, y)} is free of obstacles.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid.
     */
    public boolean passable(int x, int y) {
        return !obstacles.get(indexOf(x, y));
    }

    public boolean passable(Coordinate coordinate) {
        Objects.requireNonNull(coordinate, "coordinate");
        return passable(coordinate.x(), coordinate.y());
    }

    /**
     * Passability lookup by row-major cell index.
     */
    public boolean passableAt(int index) {
        checkIndex(index);
        return !obstacles.get(index);
    }

    public Cell cell(Coordinate coordinate) {
        return new Cell(coordinate, passable(coordinate));
    }

    /**
     * Marks a cell as an obstacle.
     *
     * @return {@code true} if the cell was passable before this call.
     */
    public boolean placeObstacle(Coordinate coordinate) {
        int index = indexOf(coordinate);
        if (obstacles.get(index)) {
            return false;
        }
        obstacles.set(index);
        return true;
    }

    /**
     * Clears an obstacle flag.
     *
     * @return {@code true} if the cell held an obstacle before this call.
     */
    public boolean clearObstacle(Coordinate coordinate) {
        int index = indexOf(coordinate);
        if (!obstacles.get(index)) {
            return false;
        }
        obstacles.clear(index);
        return true;
    }

    public int obstacleCount() {
        return obstacles.cardinality();
    }

    /**
     * Returns all obstacle cells in row-major order.
     */
    public List<Coordinate> obstacleCells() {
        List<Coordinate> cells = new ArrayList<>(obstacles.cardinality());
        for (int i = obstacles.nextSetBit(0); i >= 0; i = obstacles.nextSetBit(i + 1)) {
            cells.add(coordinateOf(i));
        }
        return cells;
    }

    /**
     * Maps a coordinate to its row-major cell index.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid.
     */
    public int indexOf(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException(
                    "coordinate (" + x + "," + y + ") outside [0, " + side + ")"
            );
        }
        return y * side + x;
    }

    public int indexOf(Coordinate coordinate) {
        Objects.requireNonNull(coordinate, "coordinate");
        return indexOf(coordinate.x(), coordinate.y());
    }

    public int xOf(int index) {
        return index % side;
    }

    public int yOf(int index) {
        return index / side;
    }

    public Coordinate coordinateOf(int index) {
        checkIndex(index);
        return new Coordinate(xOf(index), yOf(index));
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= cellCount()) {
            throw new IndexOutOfBoundsException("cell index " + index + " outside [0, " + cellCount() + ")");
        }
    }

    @Override
    public String toString() {
        return "Grid{side=" + side + ", obstacles=" + obstacles.cardinality() + '}';
    }
}
