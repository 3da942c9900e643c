package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

/**
 * First-in first-out discipline.
 */
public final class FifoQueue implements StateQueue {
    private final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

    @Override
    public int head() {
        if (queue.isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return queue.firstInt();
    }

    @Override
    public void enqueue(int state) {
        queue.enqueue(state);
    }

    @Override
    public int dequeue() {
        if (queue.isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return queue.dequeueInt();
    }

    @Override
    public void update(int state) {
        // arrival order does not depend on priority
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public QueueType queueType() {
        return QueueType.FIFO;
    }
}
