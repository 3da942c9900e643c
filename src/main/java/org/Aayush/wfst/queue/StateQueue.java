package org.Aayush.wfst.queue;

/**
 * Pending-state set with a pluggable ordering policy.
 *
 * <p>Callers never enqueue a state that is already pending; they call {@link #update(int)}
 * instead after changing the state's priority.</p>
 */
public interface StateQueue {

    /**
     * @return next state per the ordering policy, without removing it.
     * @throws EmptyQueueException if the queue is empty.
     */
    int head();

    void enqueue(int state);

    /**
     * Removes and returns the next state.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    int dequeue();

    /**
     * Re-prioritizes a pending state after its key changed.
     */
    void update(int state);

    boolean isEmpty();

    void clear();

    QueueType queueType();
}
