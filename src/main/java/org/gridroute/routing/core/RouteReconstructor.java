package org.gridroute.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.gridroute.grid.Coordinate;
import org.gridroute.grid.Grid;
import org.gridroute.routing.search.SearchNodeTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns predecessor links into an ordered {@link Route}.
 *
 * <p>The walk is bounded by the cell count. A chain that loops or stops short of the start
 * means the relaxation logic corrupted the predecessor graph; both are reported as
 * reason-coded internal failures rather than returned as routes.</p>
 */
@UtilityClass
final class RouteReconstructor {
    static final String REASON_PREDECESSOR_CYCLE = "GR_PREDECESSOR_CYCLE";
    static final String REASON_PREDECESSOR_CHAIN_BROKEN = "GR_PREDECESSOR_CHAIN_BROKEN";

    /**
     * Walks predecessors from {@code goalNode} back to {@code startNode}.
     */
    static Route reconstruct(SearchNodeTable nodes, int startNode, int goalNode) {
        Grid grid = nodes.grid();
        IntArrayList reversed = new IntArrayList();

        int cursor = goalNode;
        int guard = nodes.size();
        while (true) {
            reversed.add(cursor);
            if (cursor == startNode) {
                break;
            }
            int previous = nodes.predecessor(cursor);
            if (previous == SearchNodeTable.NO_PREDECESSOR) {
                throw new RouteSearchException(
                        REASON_PREDECESSOR_CHAIN_BROKEN,
                        "predecessor chain from " + nodes.coordinateOf(goalNode) + " ended at "
                                + nodes.coordinateOf(cursor) + " instead of " + nodes.coordinateOf(startNode)
                );
            }
            if (reversed.size() > guard) {
                throw new RouteSearchException(
                        REASON_PREDECESSOR_CYCLE,
                        "predecessor chain from " + nodes.coordinateOf(goalNode) + " exceeds " + guard + " cells"
                );
            }
            cursor = previous;
        }

        List<Coordinate> coordinates = new ArrayList<>(reversed.size());
        List<Coordinate> obstacleCells = new ArrayList<>();
        for (int i = reversed.size() - 1; i >= 0; i--) {
            int node = reversed.getInt(i);
            Coordinate cell = grid.coordinateOf(node);
            coordinates.add(cell);
            if (!grid.passableAt(node)) {
                obstacleCells.add(cell);
            }
        }
        return new Route(coordinates, obstacleCells);
    }
}
