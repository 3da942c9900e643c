package org.Aayush.wfst.fst;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Automaton whose full state set is known up front.
 *
 * @param <W> weight type.
 */
public interface ExpandedFst<W> extends Fst<W> {

    int numStates();

    /**
     * Exhaustive, stable sequence of state ids ({@code 0 .. numStates - 1}).
     */
    default IntList states() {
        int n = numStates();
        IntArrayList states = new IntArrayList(n);
        for (int s = 0; s < n; s++) {
            states.add(s);
        }
        return states;
    }
}
