package org.gridroute.grid;

/**
 * Read-only snapshot of one grid cell.
 *
 * @param coordinate cell address.
 * @param passable {@code false} when the cell holds an obstacle.
 */
public record Cell(Coordinate coordinate, boolean passable) {
}
