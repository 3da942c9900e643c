package org.Aayush.wfst.queue;

/**
 * Supported state-queue disciplines.
 *
 * <p>{@code FIFO} and {@code LIFO} work for any semiring. {@code SHORTEST_FIRST} needs the
 * natural order of an idempotent semiring. {@code TOP_ORDER} needs an acyclic automaton.
 * {@code AUTO} picks one of the others from the automaton and semiring properties.</p>
 */
public enum QueueType {
    FIFO,
    LIFO,
    SHORTEST_FIRST,
    TOP_ORDER,
    AUTO
}
