package org.Aayush.wfst.matcher;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.ConstructionException;
import org.Aayush.wfst.fst.Fst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Matcher that builds a label index per state the first time the state is looked up.
 * <p>
 * Works over lazy automata: only visited states are indexed, and each state's arcs are
 * read from the underlying automaton exactly once.
 * </p>
 *
 * @param <W> weight type.
 */
public class IndexedMatcher<W> implements Matcher<W> {

    private final Fst<W> fst;
    private final MatchType matchType;
    private final W one;

    // state -> label index
    private final Int2ObjectOpenHashMap<StateIndex<W>> indexByState = new Int2ObjectOpenHashMap<>();

    /**
     * @param fst automaton to index.
     * @param matchType {@link MatchType#MATCH_INPUT} or {@link MatchType#MATCH_OUTPUT}.
     * @throws ConstructionException for any other match type.
     */
    public IndexedMatcher(Fst<W> fst, MatchType matchType) {
        this.fst = Objects.requireNonNull(fst, "fst");
        Objects.requireNonNull(matchType, "matchType");
        if (matchType != MatchType.MATCH_INPUT && matchType != MatchType.MATCH_OUTPUT) {
            throw new ConstructionException("indexed matcher cannot match on " + matchType);
        }
        this.matchType = matchType;
        this.one = fst.semiring().one();
    }

    @Override
    public MatchType matchType() {
        return matchType;
    }

    @Override
    public Fst<W> fst() {
        return fst;
    }

    @Override
    public Iterator<Arc<W>> iterate(int state, int label) {
        StateIndex<W> index = indexFor(state);
        // callers only ever see read-only views of the index
        if (label == Arc.NO_LABEL) {
            return Collections.unmodifiableList(index.epsilons).iterator();
        }
        if (label == Arc.EPSILON) {
            return new LoopFirstIterator<>(loopArc(state), Collections.unmodifiableList(index.epsilons).iterator());
        }
        List<Arc<W>> matches = index.byLabel.get(label);
        return matches == null ? Collections.emptyIterator() : Collections.unmodifiableList(matches).iterator();
    }

    /**
     * Number of states indexed so far.
     */
    public int indexedStates() {
        return indexByState.size();
    }

    private Arc<W> loopArc(int state) {
        if (matchType == MatchType.MATCH_INPUT) {
            return new Arc<>(Arc.NO_LABEL, Arc.EPSILON, one, state);
        }
        return new Arc<>(Arc.EPSILON, Arc.NO_LABEL, one, state);
    }

    private StateIndex<W> indexFor(int state) {
        StateIndex<W> index = indexByState.get(state);
        if (index == null) {
            index = new StateIndex<>();
            for (Arc<W> arc : fst.arcs(state)) {
                int label = matchType == MatchType.MATCH_INPUT ? arc.ilabel() : arc.olabel();
                if (label == Arc.EPSILON) {
                    index.epsilons.add(arc);
                } else {
                    List<Arc<W>> bucket = index.byLabel.get(label);
                    if (bucket == null) {
                        bucket = new ArrayList<>(1);
                        index.byLabel.put(label, bucket);
                    }
                    bucket.add(arc);
                }
            }
            indexByState.put(state, index);
        }
        return index;
    }

    private static final class StateIndex<W> {
        private final List<Arc<W>> epsilons = new ArrayList<>();
        private final Int2ObjectOpenHashMap<List<Arc<W>>> byLabel = new Int2ObjectOpenHashMap<>();
    }

    /**
     * Yields the implicit loop arc, then the explicit epsilon arcs.
     */
    private static final class LoopFirstIterator<W> implements Iterator<Arc<W>> {
        private Arc<W> loop;
        private final Iterator<Arc<W>> rest;

        private LoopFirstIterator(Arc<W> loop, Iterator<Arc<W>> rest) {
            this.loop = loop;
            this.rest = rest;
        }

        @Override
        public boolean hasNext() {
            return loop != null || rest.hasNext();
        }

        @Override
        public Arc<W> next() {
            if (loop != null) {
                Arc<W> result = loop;
                loop = null;
                return result;
            }
            if (!rest.hasNext()) {
                throw new NoSuchElementException();
            }
            return rest.next();
        }
    }
}
