package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntComparator;
import org.Aayush.wfst.fst.ArcFilter;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.SemiringProperty;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Discipline chosen from declared automaton and semiring properties:
 * <ol>
 * <li>acyclic from the source: topological order, each state is visited once;</li>
 * <li>idempotent semiring with the path property: shortest-first by natural order;</li>
 * <li>otherwise: FIFO, valid for any semiring.</li>
 * </ol>
 */
public final class AutoQueue implements StateQueue {
    private static final Logger logger = Logger.getLogger(AutoQueue.class.getName());

    private final StateQueue delegate;

    public <W> AutoQueue(Fst<W> fst, int source, ArcFilter<W> arcFilter, IntComparator distanceOrder) {
        this.delegate = select(fst, source, arcFilter, distanceOrder);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("auto queue selected " + delegate.queueType()
                    + " for semiring " + fst.semiring().name() + " from source " + source);
        }
    }

    private static <W> StateQueue select(Fst<W> fst, int source, ArcFilter<W> arcFilter, IntComparator distanceOrder) {
        TopologicalOrder order = TopologicalOrder.compute(fst, source, arcFilter);
        if (order != null) {
            return new TopOrderQueue(order);
        }
        Semiring<W> semiring = fst.semiring();
        if (semiring.hasProperty(SemiringProperty.IDEMPOTENT) && semiring.hasProperty(SemiringProperty.PATH)) {
            return new ShortestFirstQueue(distanceOrder);
        }
        return new FifoQueue();
    }

    /**
     * @return discipline actually in use.
     */
    public QueueType selectedType() {
        return delegate.queueType();
    }

    @Override
    public int head() {
        return delegate.head();
    }

    @Override
    public void enqueue(int state) {
        delegate.enqueue(state);
    }

    @Override
    public int dequeue() {
        return delegate.dequeue();
    }

    @Override
    public void update(int state) {
        delegate.update(state);
    }

    @Override
    public boolean isEmpty() {
        return delegate.isEmpty();
    }

    @Override
    public void clear() {
        delegate.clear();
    }

    @Override
    public QueueType queueType() {
        return QueueType.AUTO;
    }
}
