package org.Aayush.wfst.fst;

import org.Aayush.wfst.semiring.Semiring;

import java.util.List;

/**
 * Read-only automaton view consumed by the algorithms.
 *
 * <p>Implementations may be lazy: {@link #arcs(int)} and {@link #finalWeight(int)} may
 * compute and cache their result on first access. State ids are dense and stable for the
 * lifetime of the instance.</p>
 *
 * @param <W> weight type.
 */
public interface Fst<W> {
    int NO_STATE = -1;

    Semiring<W> semiring();

    /**
     * @return start state, or {@link #NO_STATE} when the automaton has none.
     */
    int start();

    /**
     * Outgoing arcs of {@code state}.
     *
     * @throws InvalidStateException when the state id is unknown.
     */
    List<Arc<W>> arcs(int state);

    /**
     * Final weight of {@code state}, or {@code null} when the state is not final.
     *
     * @throws InvalidStateException when the state id is unknown.
     */
    W finalWeight(int state);

    default boolean isFinal(int state) {
        return finalWeight(state) != null;
    }

    default int numArcs(int state) {
        return arcs(state).size();
    }

    default int numInputEpsilons(int state) {
        int count = 0;
        for (Arc<W> arc : arcs(state)) {
            if (arc.ilabel() == Arc.EPSILON) {
                count++;
            }
        }
        return count;
    }

    default int numOutputEpsilons(int state) {
        int count = 0;
        for (Arc<W> arc : arcs(state)) {
            if (arc.olabel() == Arc.EPSILON) {
                count++;
            }
        }
        return count;
    }
}
