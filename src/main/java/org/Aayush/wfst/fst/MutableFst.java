package org.Aayush.wfst.fst;

/**
 * Automaton that supports incremental construction.
 *
 * @param <W> weight type.
 */
public interface MutableFst<W> extends ExpandedFst<W> {

    /**
     * Appends a new non-final state and returns its id.
     */
    int addState();

    void addArc(int state, Arc<W> arc);

    void setStart(int state);

    /**
     * Sets the final weight of {@code state}; a weight equal to the semiring zero makes the
     * state non-final.
     */
    void setFinal(int state, W weight);
}
