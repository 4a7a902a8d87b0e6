package org.gridroute.grid;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Random obstacle placement used to set up a grid before searching it.
 *
 * <p>Candidates are every cell that is neither reserved (start/goal) nor already an
 * obstacle. Requests larger than the candidate pool are clamped so that every candidate
 * becomes an obstacle.</p>
 */
public final class ObstaclePlacer {
    private static final Logger log = LoggerFactory.getLogger(ObstaclePlacer.class);

    private final Random random;

    /**
     * @param random randomness source; pass a seeded instance for reproducible layouts.
     */
    public ObstaclePlacer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Places up to {@code count} obstacles on free, non-reserved cells.
     *
     * @param grid grid to mutate.
     * @param count number of obstacles requested (must be non-negative).
     * @param reserved cells that must stay passable (typically start and goal).
     * @return placed coordinates in placement order.
     */
    public List<Coordinate> place(Grid grid, int count, Coordinate... reserved) {
        Objects.requireNonNull(grid, "grid");
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got " + count);
        }

        IntArrayList candidates = candidateCells(grid, reserved);
        int placeCount = Math.min(count, candidates.size());
        if (placeCount < count) {
            log.info("Requested {} obstacles but only {} free cells remain; filling all of them", count, placeCount);
        }

        List<Coordinate> placed = new ArrayList<>(placeCount);
        for (int i = 0; i < placeCount; i++) {
            int pick = random.nextInt(candidates.size());
            int cellIndex = candidates.getInt(pick);
            // swap-remove keeps each pick O(1)
            int lastIndex = candidates.size() - 1;
            candidates.set(pick, candidates.getInt(lastIndex));
            candidates.removeInt(lastIndex);

            Coordinate cell = grid.coordinateOf(cellIndex);
            grid.placeObstacle(cell);
            placed.add(cell);
        }
        log.debug("Placed {} obstacles on {}", placed.size(), grid);
        return Collections.unmodifiableList(placed);
    }

    private static IntArrayList candidateCells(Grid grid, Coordinate... reserved) {
        boolean[] isReserved = new boolean[grid.cellCount()];
        for (Coordinate cell : reserved) {
            if (cell != null && grid.inBounds(cell)) {
                isReserved[grid.indexOf(cell)] = true;
            }
        }
        IntArrayList candidates = new IntArrayList(grid.cellCount());
        for (int index = 0; index < grid.cellCount(); index++) {
            if (!isReserved[index] && grid.passableAt(index)) {
                candidates.add(index);
            }
        }
        return candidates;
    }
}
