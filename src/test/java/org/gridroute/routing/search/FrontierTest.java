package org.gridroute.routing.search;

import org.gridroute.grid.Grid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Frontier Tests")
class FrontierTest {

    private SearchNodeTable nodes;

    @BeforeEach
    void setUp() {
        // zero heuristic so f == g and keys are easy to read
        nodes = new SearchNodeTable(new Grid(3), (x, y) -> 0);
    }

    private void offer(Frontier frontier, int node, int cost, int obstacles) {
        nodes.record(node, cost, obstacles, SearchNodeTable.NO_PREDECESSOR);
        frontier.insertOrUpdate(node);
    }

    @Nested
    @DisplayName("1. Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Strict: lower f is popped first")
        void testStrictOrdering() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            offer(frontier, 0, 5, 0);
            offer(frontier, 1, 2, 0);
            offer(frontier, 2, 3, 0);

            assertEquals(1, frontier.popBest());
            assertEquals(2, frontier.popBest());
            assertEquals(0, frontier.popBest());
            assertTrue(frontier.isEmpty());
        }

        @Test
        @DisplayName("Relaxed: fewer obstacles beat a lower f")
        void testRelaxedOrdering() {
            Frontier frontier = new Frontier(nodes, SearchMode.RELAXED);
            offer(frontier, 0, 1, 2);
            offer(frontier, 1, 9, 0);
            offer(frontier, 2, 4, 0);

            assertEquals(2, frontier.popBest(), "obstacles 0, f 4");
            assertEquals(1, frontier.popBest(), "obstacles 0, f 9");
            assertEquals(0, frontier.popBest(), "obstacles 2, f 1");
        }

        @Test
        @DisplayName("Strict: obstacle count is ignored")
        void testStrictIgnoresObstacles() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            offer(frontier, 0, 1, 2);
            offer(frontier, 1, 9, 0);
            offer(frontier, 2, 4, 0);

            assertEquals(0, frontier.popBest());
            assertEquals(2, frontier.popBest());
            assertEquals(1, frontier.popBest());
        }

        @Test
        @DisplayName("Equal keys pop in arrival order")
        void testArrivalOrderTieBreak() {
            Frontier frontier = new Frontier(nodes, SearchMode.RELAXED);
            offer(frontier, 4, 3, 1);
            offer(frontier, 2, 3, 1);
            offer(frontier, 7, 3, 1);
            offer(frontier, 5, 3, 1);

            assertEquals(4, frontier.popBest());
            assertEquals(2, frontier.popBest());
            assertEquals(7, frontier.popBest());
            assertEquals(5, frontier.popBest());
        }
    }

    @Nested
    @DisplayName("2. Insert-or-update")
    class UpdateTests {

        @Test
        @DisplayName("Improving a queued node updates in place without duplicates")
        void testDecreaseKeyInPlace() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            offer(frontier, 4, 5, 0);
            offer(frontier, 2, 3, 0);
            offer(frontier, 4, 1, 0);
            offer(frontier, 4, 0, 0);

            assertEquals(2, frontier.size(), "Should only have one entry for node 4");
            assertEquals(4, frontier.popBest());
            assertEquals(0, nodes.costFromStart(4), "Should keep the best cost");
        }

        @Test
        @DisplayName("In-place update keeps the original arrival position")
        void testUpdateKeepsArrival() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            offer(frontier, 1, 3, 0);
            offer(frontier, 6, 5, 0);
            offer(frontier, 6, 3, 0);

            assertEquals(1, frontier.popBest(), "Node 1 arrived first and ties on f");
            assertEquals(6, frontier.popBest());
        }

        @Test
        @DisplayName("A re-opened node queues behind earlier arrivals")
        void testReopenedNodeIsNewArrival() {
            Frontier frontier = new Frontier(nodes, SearchMode.RELAXED);
            offer(frontier, 1, 3, 0);
            assertEquals(1, frontier.popBest());
            assertEquals(NodeMembership.CLOSED, nodes.membership(1));

            offer(frontier, 8, 3, 0);
            offer(frontier, 1, 3, 0);
            assertEquals(NodeMembership.OPEN, nodes.membership(1));
            assertEquals(8, frontier.popBest());
            assertEquals(1, frontier.popBest());
        }

        @Test
        @DisplayName("Membership follows heap presence")
        void testMembership() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            assertEquals(NodeMembership.UNSEEN, nodes.membership(3));
            offer(frontier, 3, 1, 0);
            assertTrue(frontier.contains(3));
            assertEquals(NodeMembership.OPEN, nodes.membership(3));

            frontier.popBest();
            assertFalse(frontier.contains(3));
            assertEquals(NodeMembership.CLOSED, nodes.membership(3));
        }

        @Test
        @DisplayName("Peak size tracks the high-water mark")
        void testPeakSize() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            offer(frontier, 0, 1, 0);
            offer(frontier, 1, 2, 0);
            offer(frontier, 2, 3, 0);
            frontier.popBest();
            frontier.popBest();
            offer(frontier, 3, 1, 0);

            assertEquals(2, frontier.size());
            assertEquals(3, frontier.getPeakSize());
        }
    }

    @Nested
    @DisplayName("3. Contracts")
    class ContractTests {

        @Test
        @DisplayName("Popping an empty frontier throws")
        void testEmptyPop() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            assertThrows(EmptyFrontierException.class, frontier::popBest);
            assertThrows(EmptyFrontierException.class, frontier::peekBest);
        }

        @Test
        @DisplayName("Nodes without a recorded cost cannot be queued")
        void testRequiresRecordedCost() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            assertThrows(IllegalStateException.class, () -> frontier.insertOrUpdate(0));
        }

        @Test
        @DisplayName("Node ids are bounds-checked")
        void testBounds() {
            Frontier frontier = new Frontier(nodes, SearchMode.STRICT);
            assertThrows(IllegalArgumentException.class, () -> frontier.insertOrUpdate(9));
            assertThrows(IllegalArgumentException.class, () -> frontier.contains(-1));
        }

        @Test
        @DisplayName("Randomized pops come out in non-decreasing key order")
        void testRandomizedHeapOrder() {
            SearchNodeTable big = new SearchNodeTable(new Grid(20), (x, y) -> 0);
            Frontier frontier = new Frontier(big, SearchMode.RELAXED);
            Random random = new Random(12345L);
            for (int node = 0; node < big.size(); node++) {
                big.record(node, random.nextInt(50), random.nextInt(4), SearchNodeTable.NO_PREDECESSOR);
                frontier.insertOrUpdate(node);
            }

            int lastObstacles = -1;
            int lastCost = -1;
            while (!frontier.isEmpty()) {
                int node = frontier.popBest();
                int obstacles = big.obstaclesCrossed(node);
                int cost = big.costFromStart(node);
                assertTrue(obstacles > lastObstacles || (obstacles == lastObstacles && cost >= lastCost),
                        "Keys must be popped in lexicographic order");
                lastObstacles = obstacles;
                lastCost = cost;
            }
        }
    }
}
