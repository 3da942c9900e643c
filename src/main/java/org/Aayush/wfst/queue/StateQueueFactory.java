package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntComparator;
import org.Aayush.wfst.fst.ArcFilter;
import org.Aayush.wfst.fst.Fst;

/**
 * Builds a queue discipline for one shortest-distance run.
 *
 * @param <W> weight type.
 */
@FunctionalInterface
public interface StateQueueFactory<W> {

    /**
     * @param fst automaton being searched.
     * @param source state the run starts from.
     * @param arcFilter arcs the run may follow.
     * @param distanceOrder natural order of the run's current distance estimates.
     * @return empty queue ready for the run.
     */
    StateQueue create(Fst<W> fst, int source, ArcFilter<W> arcFilter, IntComparator distanceOrder);
}
