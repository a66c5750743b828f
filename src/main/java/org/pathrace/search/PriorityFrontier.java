package org.pathrace.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Min-priority queue for weighted graph search (Dijkstra/A*).
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Duplicate Insertion:</strong> the same item may be inserted any number of times with
 * different scores. There is no decrease-key; callers discard stale extractions by comparing the
 * extracted score with their own best-known score.</li>
 * <li><strong>Stable Ties:</strong> entries with equal scores leave in insertion order.</li>
 * <li><strong>Growable:</strong> the backing heap doubles on demand.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public class PriorityFrontier {
    private static final int DEFAULT_CAPACITY = 16;

    // Binary heap, 1-based indexing for simpler parent/child math
    private FrontierEntry[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;
    private long nextSequence = 0L;

    // Diagnostics
    @Getter
    private int peakSize = 0;

    public PriorityFrontier() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param initialCapacity expected simultaneous entries; must be positive.
     * @throws IllegalArgumentException if capacity is not positive.
     */
    public PriorityFrontier(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.heap = new FrontierEntry[initialCapacity + 1];
    }

    /**
     * Inserts one entry in {@code O(log n)}.
     *
     * @param score finite priority score.
     * @param item dense node index.
     * @throws IllegalArgumentException if {@code score} is NaN or infinite.
     */
    public void insert(double score, int item) {
        if (!Double.isFinite(score)) {
            throw new IllegalArgumentException("score must be finite, got " + score);
        }
        if (size >= heap.length - 1) {
            heap = Arrays.copyOf(heap, heap.length * 2);
        }
        size++;
        heap[size] = new FrontierEntry(score, nextSequence++, item);
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
    }

    /**
     * Removes and returns the lowest-score entry in {@code O(log n)}.
     *
     * @return minimum entry.
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public FrontierEntry extractMin() {
        if (isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }
        FrontierEntry min = heap[1];
        heap[1] = heap[size];
        heap[size] = null;
        size--;
        if (size > 1) {
            sink(1);
        }
        return min;
    }

    /**
     * Returns the lowest-score entry without removing it.
     *
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public FrontierEntry peek() {
        if (isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }
        return heap[1];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Drops all entries and restarts the insertion sequence.
     */
    public void clear() {
        Arrays.fill(heap, 1, size + 1, null);
        size = 0;
        nextSequence = 0L;
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
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        FrontierEntry tmp = heap[i];
        heap[i] = heap[j];
        heap[j] = tmp;
    }
}
