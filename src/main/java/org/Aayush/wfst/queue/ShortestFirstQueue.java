package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparator;

import java.util.Objects;

/**
 * Min-priority state queue ordered by an external comparator, typically the natural order of
 * the current distance estimates.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Decrease-Key Support:</strong> {@link #update(int)} repositions a pending state in
 * O(log n) through a state-indexed position array.</li>
 * <li><strong>Lazy Growth:</strong> the position array grows with the largest state id seen, so the
 * queue works over lazily discovered automata.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public final class ShortestFirstQueue implements StateQueue {

    // 1-based binary heap of state ids
    private final IntArrayList heap = new IntArrayList();
    // positions[state] = heap index, 0 when not pending
    private final IntArrayList positions = new IntArrayList();
    private final IntComparator order;
    private int size;

    /**
     * @param order priority order; states comparing lower are dequeued first.
     */
    public ShortestFirstQueue(IntComparator order) {
        this.order = Objects.requireNonNull(order, "order");
        heap.add(-1); // slot 0 unused
    }

    @Override
    public int head() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return heap.getInt(1);
    }

    @Override
    public void enqueue(int state) {
        if (state < 0) {
            throw new IllegalArgumentException("state " + state + " must be non-negative");
        }
        ensurePosition(state);
        if (positions.getInt(state) != 0) {
            update(state);
            return;
        }
        size++;
        if (heap.size() <= size) {
            heap.add(state);
        } else {
            heap.set(size, state);
        }
        positions.set(state, size);
        swim(size);
    }

    @Override
    public int dequeue() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int min = heap.getInt(1);
        int last = heap.getInt(size);
        heap.set(1, last);
        positions.set(last, 1);
        positions.set(min, 0);
        size--;
        if (size > 0) {
            sink(1);
        }
        return min;
    }

    @Override
    public void update(int state) {
        if (state < 0 || state >= positions.size() || positions.getInt(state) == 0) {
            return;
        }
        int index = positions.getInt(state);
        swim(index);
        sink(positions.getInt(state));
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions.set(heap.getInt(i), 0);
        }
        size = 0;
    }

    @Override
    public QueueType queueType() {
        return QueueType.SHORTEST_FIRST;
    }

    /**
     * @return number of pending states.
     */
    public int size() {
        return size;
    }

    private void ensurePosition(int state) {
        while (positions.size() <= state) {
            positions.add(0);
        }
    }

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
        return order.compare(heap.getInt(i), heap.getInt(j)) > 0;
    }

    private void swap(int i, int j) {
        int s1 = heap.getInt(i);
        int s2 = heap.getInt(j);
        heap.set(i, s2);
        heap.set(j, s1);
        positions.set(s1, j);
        positions.set(s2, i);
    }
}
