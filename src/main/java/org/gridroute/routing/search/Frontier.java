package org.gridroute.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Open set of a grid search: an indexed binary min-heap over node ids.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>No Duplicates:</strong> A node already in the heap is updated in place through
 * an internal position tracking array; the heap never holds more than one entry per cell.</li>
 * <li><strong>Mode-dependent Ordering:</strong> {@link SearchMode#STRICT} orders by {@code f};
 * {@link SearchMode#RELAXED} orders by {@code (obstaclesCrossed, f)}.</li>
 * <li><strong>Deterministic Ties:</strong> Equal keys fall back to the order in which nodes
 * entered the heap. An in-place update keeps the original entry order; a node that re-enters
 * after being closed is ordered as a new arrival.</li>
 * </ul>
 * </p>
 * <p>Keys are read live from the {@link SearchNodeTable}. Callers must only ever improve a
 * queued node's key and must call {@link #insertOrUpdate(int)} after every such change.</p>
 *
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public final class Frontier {

    private final SearchNodeTable nodes;
    private final SearchMode mode;

    // 1-based binary heap of node ids
    private final int[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // positions[node] = heap index, 0 when absent
    private final int[] positions;

    // entryOrder[node] = arrival sequence of the node's current heap entry
    private final long[] entryOrder;
    private long nextEntry = 0L;

    @Getter
    private int peakSize = 0;

    /**
     * Creates an empty frontier sized for every node of {@code nodes}.
     *
     * @param nodes node table providing keys.
     * @param mode ordering policy.
     */
    public Frontier(SearchNodeTable nodes, SearchMode mode) {
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        this.mode = Objects.requireNonNull(mode, "mode");
        int capacity = nodes.size();
        this.heap = new int[capacity + 1];
        this.positions = new int[capacity];
        this.entryOrder = new long[capacity];
    }

    /**
     * Adds a node to the frontier, or restores heap order after its key improved.
     * <p>
     * The node must already carry a recorded cost in the node table. On return its
     * membership is {@link NodeMembership#OPEN}.
     * </p>
     *
     * @param node node id.
     * @throws IllegalArgumentException if {@code node} is out of range.
     * @throws IllegalStateException    if the node has no recorded cost.
     */
    public void insertOrUpdate(int node) {
        checkNode(node);

        int existingIdx = positions[node];
        if (existingIdx > 0) {
            // key only ever improves, so sifting up is enough
            swim(existingIdx);
            return;
        }

        nodes.markOpen(node);
        size++;
        heap[size] = node;
        positions[node] = size;
        entryOrder[node] = nextEntry++;
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
    }

    /**
     * Removes the best node according to the mode's ordering and marks it closed.
     *
     * @return node id of the best entry.
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public int popBest() {
        if (isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }

        int best = heap[1];
        int last = heap[size];
        heap[size] = 0;
        size--;
        positions[best] = 0;

        if (size > 0) {
            heap[1] = last;
            positions[last] = 1;
            sink(1);
        }

        nodes.markClosed(best);
        return best;
    }

    /**
     * Returns the best node without removing it.
     *
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public int peekBest() {
        if (isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }
        return heap[1];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean contains(int node) {
        checkNode(node);
        return positions[node] > 0;
    }

    /**
     * Orders two queued nodes; negative when {@code a} should be expanded first.
     */
    int compare(int a, int b) {
        if (mode == SearchMode.RELAXED) {
            int byObstacles = Integer.compare(nodes.obstaclesCrossed(a), nodes.obstaclesCrossed(b));
            if (byObstacles != 0) {
                return byObstacles;
            }
        }
        int byF = Integer.compare(nodes.fScore(a), nodes.fScore(b));
        if (byF != 0) {
            return byF;
        }
        return Long.compare(entryOrder[a], entryOrder[b]);
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return compare(heap[i], heap[j]) > 0;
    }

    private void swap(int i, int j) {
        int n1 = heap[i];
        int n2 = heap[j];
        heap[i] = n2;
        heap[j] = n1;
        positions[n1] = j;
        positions[n2] = i;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= positions.length) {
            throw new IllegalArgumentException("node " + node + " out of bounds (max: " + (positions.length - 1) + ")");
        }
    }
}
