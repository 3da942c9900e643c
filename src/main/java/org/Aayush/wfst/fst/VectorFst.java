package org.Aayush.wfst.fst;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.semiring.Semiring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Array-backed mutable automaton.
 *
 * <p>Per-state data lives in parallel fastutil lists indexed by state id. Epsilon counts are
 * maintained on {@link #addArc(int, Arc)} so filter bookkeeping stays O(1).</p>
 *
 * <p><strong>Thread Safety:</strong> not thread-safe; build on one thread, then share read-only.</p>
 *
 * @param <W> weight type.
 */
public class VectorFst<W> implements MutableFst<W> {

    private final Semiring<W> semiring;
    private final ObjectArrayList<List<Arc<W>>> arcsByState = new ObjectArrayList<>();
    private final ObjectArrayList<W> finalByState = new ObjectArrayList<>();
    private final IntArrayList inputEpsilonsByState = new IntArrayList();
    private final IntArrayList outputEpsilonsByState = new IntArrayList();
    private int start = NO_STATE;

    public VectorFst(Semiring<W> semiring) {
        this.semiring = Objects.requireNonNull(semiring, "semiring");
    }

    /**
     * Materializes any automaton into a new {@code VectorFst}.
     * <p>
     * An {@link ExpandedFst} source keeps its state ids. A lazy source is explored breadth-first
     * from its start state and renumbered in discovery order, so two structurally equal lazy
     * automata materialize to equal copies.
     * </p>
     *
     * @param fst source automaton.
     * @return independent mutable copy.
     */
    public static <W> VectorFst<W> copyOf(Fst<W> fst) {
        Objects.requireNonNull(fst, "fst");
        VectorFst<W> copy = new VectorFst<>(fst.semiring());
        if (fst instanceof ExpandedFst) {
            ExpandedFst<W> expanded = (ExpandedFst<W>) fst;
            int n = expanded.numStates();
            for (int s = 0; s < n; s++) {
                copy.addState();
            }
            for (int s = 0; s < n; s++) {
                for (Arc<W> arc : expanded.arcs(s)) {
                    copy.addArc(s, arc);
                }
                W finalWeight = expanded.finalWeight(s);
                if (finalWeight != null) {
                    copy.setFinal(s, finalWeight);
                }
            }
            if (expanded.start() != NO_STATE) {
                copy.setStart(expanded.start());
            }
            return copy;
        }

        int sourceStart = fst.start();
        if (sourceStart == NO_STATE) {
            return copy;
        }
        Int2IntOpenHashMap copyIds = new Int2IntOpenHashMap();
        copyIds.defaultReturnValue(NO_STATE);
        IntArrayFIFOQueue frontier = new IntArrayFIFOQueue();
        copyIds.put(sourceStart, copy.addState());
        frontier.enqueue(sourceStart);
        while (!frontier.isEmpty()) {
            int state = frontier.dequeueInt();
            int copyState = copyIds.get(state);
            for (Arc<W> arc : fst.arcs(state)) {
                int target = copyIds.get(arc.nextState());
                if (target == NO_STATE) {
                    target = copy.addState();
                    copyIds.put(arc.nextState(), target);
                    frontier.enqueue(arc.nextState());
                }
                copy.addArc(copyState, new Arc<>(arc.ilabel(), arc.olabel(), arc.weight(), target));
            }
            W finalWeight = fst.finalWeight(state);
            if (finalWeight != null) {
                copy.setFinal(copyState, finalWeight);
            }
        }
        copy.setStart(copyIds.get(sourceStart));
        return copy;
    }

    @Override
    public Semiring<W> semiring() {
        return semiring;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        checkState(state);
        return Collections.unmodifiableList(arcsByState.get(state));
    }

    @Override
    public W finalWeight(int state) {
        checkState(state);
        return finalByState.get(state);
    }

    @Override
    public int numArcs(int state) {
        checkState(state);
        return arcsByState.get(state).size();
    }

    @Override
    public int numInputEpsilons(int state) {
        checkState(state);
        return inputEpsilonsByState.getInt(state);
    }

    @Override
    public int numOutputEpsilons(int state) {
        checkState(state);
        return outputEpsilonsByState.getInt(state);
    }

    @Override
    public int numStates() {
        return arcsByState.size();
    }

    @Override
    public int addState() {
        int state = arcsByState.size();
        arcsByState.add(new ArrayList<>());
        finalByState.add(null);
        inputEpsilonsByState.add(0);
        outputEpsilonsByState.add(0);
        return state;
    }

    @Override
    public void addArc(int state, Arc<W> arc) {
        checkState(state);
        Objects.requireNonNull(arc, "arc");
        checkState(arc.nextState());
        if (arc.ilabel() < 0 || arc.olabel() < 0) {
            throw new IllegalArgumentException("stored arcs need non-negative labels, got " + arc);
        }
        arcsByState.get(state).add(arc);
        if (arc.ilabel() == Arc.EPSILON) {
            inputEpsilonsByState.set(state, inputEpsilonsByState.getInt(state) + 1);
        }
        if (arc.olabel() == Arc.EPSILON) {
            outputEpsilonsByState.set(state, outputEpsilonsByState.getInt(state) + 1);
        }
    }

    /**
     * Convenience for {@code addArc(state, new Arc<>(ilabel, olabel, weight, nextState))}.
     */
    public void addArc(int state, int ilabel, int olabel, W weight, int nextState) {
        addArc(state, new Arc<>(ilabel, olabel, weight, nextState));
    }

    @Override
    public void setStart(int state) {
        checkState(state);
        this.start = state;
    }

    @Override
    public void setFinal(int state, W weight) {
        checkState(state);
        Objects.requireNonNull(weight, "weight");
        finalByState.set(state, semiring.isZero(weight) ? null : weight);
    }

    private void checkState(int state) {
        if (state < 0 || state >= arcsByState.size()) {
            throw InvalidStateException.unknownState(state, arcsByState.size());
        }
    }

    @Override
    public String toString() {
        return "VectorFst{" +
                "semiring=" + semiring.name() +
                ", states=" + numStates() +
                ", start=" + start +
                '}';
    }
}
