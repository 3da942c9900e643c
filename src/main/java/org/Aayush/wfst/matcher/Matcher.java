package org.Aayush.wfst.matcher;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;

import java.util.Iterator;

/**
 * Label-indexed arc lookup over one automaton.
 *
 * <p>Lookup contract for {@link #iterate(int, int)}:</p>
 * <ul>
 * <li>{@code label > 0}: arcs at {@code state} whose matched-side label equals {@code label}.</li>
 * <li>{@code label == }{@link Arc#EPSILON}: first an implicit loop that keeps the automaton at
 * {@code state} with weight one and {@link Arc#NO_LABEL} on the matched side, then every
 * explicit arc whose matched-side label is epsilon.</li>
 * <li>{@code label == }{@link Arc#NO_LABEL}: explicit epsilon arcs only.</li>
 * </ul>
 *
 * <p>Matchers keep per-state cursors and are not safe for interleaved use; share them through
 * a {@link MatcherSlot}.</p>
 *
 * @param <W> weight type.
 */
public interface Matcher<W> {

    MatchType matchType();

    Fst<W> fst();

    /**
     * Arcs at {@code state} matching {@code label}; see the class contract.
     */
    Iterator<Arc<W>> iterate(int state, int label);

    /**
     * Final weight passthrough, {@code null} when {@code state} is not final.
     */
    default W finalWeight(int state) {
        return fst().finalWeight(state);
    }
}
