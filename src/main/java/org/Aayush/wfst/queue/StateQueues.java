package org.Aayush.wfst.queue;

import lombok.experimental.UtilityClass;
import org.Aayush.wfst.fst.AlgebraicPreconditionException;
import org.Aayush.wfst.fst.ConstructionException;
import org.Aayush.wfst.semiring.SemiringProperty;

import java.util.Objects;

/**
 * Stock {@link StateQueueFactory} instances.
 */
@UtilityClass
public final class StateQueues {

    public static <W> StateQueueFactory<W> fifo() {
        return (fst, source, arcFilter, distanceOrder) -> new FifoQueue();
    }

    public static <W> StateQueueFactory<W> lifo() {
        return (fst, source, arcFilter, distanceOrder) -> new LifoQueue();
    }

    /**
     * Shortest-first by natural order.
     *
     * @throws AlgebraicPreconditionException at creation when the semiring is not idempotent.
     */
    public static <W> StateQueueFactory<W> shortestFirst() {
        return (fst, source, arcFilter, distanceOrder) -> {
            if (!fst.semiring().hasProperty(SemiringProperty.IDEMPOTENT)) {
                throw new AlgebraicPreconditionException(
                        "shortest-first queue needs an idempotent semiring, got " + fst.semiring().name()
                );
            }
            return new ShortestFirstQueue(distanceOrder);
        };
    }

    /**
     * Topological order.
     *
     * @throws ConstructionException at creation when a cycle is reachable from the source.
     */
    public static <W> StateQueueFactory<W> topOrder() {
        return (fst, source, arcFilter, distanceOrder) -> {
            TopologicalOrder order = TopologicalOrder.compute(fst, source, arcFilter);
            if (order == null) {
                throw new ConstructionException("top-order queue needs an acyclic automaton");
            }
            return new TopOrderQueue(order);
        };
    }

    public static <W> StateQueueFactory<W> auto() {
        return AutoQueue::new;
    }

    /**
     * Factory for an explicit discipline.
     */
    public static <W> StateQueueFactory<W> forType(QueueType type) {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case FIFO:
                return fifo();
            case LIFO:
                return lifo();
            case SHORTEST_FIRST:
                return shortestFirst();
            case TOP_ORDER:
                return topOrder();
            case AUTO:
                return auto();
            default:
                throw new IllegalArgumentException("unsupported queue type " + type);
        }
    }
}
