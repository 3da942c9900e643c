package org.Aayush.wfst.compose;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;

import java.util.Collections;
import java.util.List;

/**
 * Per-state cache of a lazily built automaton.
 * <p>
 * Outgoing arcs and the final weight of each state are stored exactly once. Storing either a
 * second time is an invariant breach and fails with {@link IllegalStateException}.
 * </p>
 *
 * @param <W> weight type.
 */
public final class CacheImpl<W> {
    private final ObjectArrayList<List<Arc<W>>> arcsByState = new ObjectArrayList<>();
    private final ObjectArrayList<W> finalByState = new ObjectArrayList<>();
    private final BooleanArrayList finalKnownByState = new BooleanArrayList();

    private int start = Fst.NO_STATE;
    private boolean startKnown;
    private int expandedStates;

    public boolean hasStart() {
        return startKnown;
    }

    public int start() {
        return start;
    }

    public void setStart(int state) {
        if (startKnown) {
            throw new IllegalStateException("start state already cached");
        }
        this.start = state;
        this.startKnown = true;
    }

    public boolean hasArcs(int state) {
        return state < arcsByState.size() && arcsByState.get(state) != null;
    }

    /**
     * @return cached arcs; callers must check {@link #hasArcs(int)} first.
     */
    public List<Arc<W>> arcs(int state) {
        return arcsByState.get(state);
    }

    /**
     * Stores the complete outgoing arc list of {@code state}.
     */
    public void setArcs(int state, List<Arc<W>> arcs) {
        ensureCapacity(state);
        if (arcsByState.get(state) != null) {
            throw new IllegalStateException("arcs of state " + state + " already cached");
        }
        arcsByState.set(state, Collections.unmodifiableList(arcs));
        expandedStates++;
    }

    public boolean hasFinal(int state) {
        return state < finalKnownByState.size() && finalKnownByState.getBoolean(state);
    }

    /**
     * @return cached final weight, {@code null} when the state is not final.
     */
    public W finalWeight(int state) {
        return finalByState.get(state);
    }

    /**
     * Stores the final weight of {@code state}; {@code null} records "not final".
     */
    public void setFinal(int state, W weight) {
        ensureCapacity(state);
        if (finalKnownByState.getBoolean(state)) {
            throw new IllegalStateException("final weight of state " + state + " already cached");
        }
        finalByState.set(state, weight);
        finalKnownByState.set(state, true);
    }

    /**
     * Number of states whose arcs have been cached.
     */
    public int expandedStates() {
        return expandedStates;
    }

    private void ensureCapacity(int state) {
        while (arcsByState.size() <= state) {
            arcsByState.add(null);
            finalByState.add(null);
            finalKnownByState.add(false);
        }
    }
}
