package org.Aayush.wfst.compose;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.ConstructionException;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.matcher.MatchType;
import org.Aayush.wfst.matcher.Matcher;
import org.Aayush.wfst.matcher.MatcherSlot;
import org.Aayush.wfst.semiring.Semiring;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Lazy, memoized construction of the product of two automata.
 * <p>
 * Product states are keyed by {@link ComposeStateTuple}s in a {@link StateTable}; their arcs
 * and final weights are computed on first access and kept in a {@link CacheImpl}. Each state
 * is expanded at most once, and an expansion that fails leaves no cached arcs behind.
 * </p>
 * <p>
 * Expansion order for one state: the driving side's implicit stay loop is probed first, then
 * every real arc of the driving state, each looked up through the other side's matcher.
 * </p>
 *
 * @param <W>  weight type.
 * @param <FS> filter state type.
 */
final class ComposeFstImpl<W, FS extends FilterState> {

    private final Fst<W> fst1;
    private final Fst<W> fst2;
    private final Semiring<W> semiring;
    private final ComposeFilter<W, FS> filter;
    private final boolean matchInput;
    private final StateTable<ComposeStateTuple<FS>> stateTable = new StateTable<>();
    private final CacheImpl<W> cache = new CacheImpl<>();

    ComposeFstImpl(Fst<W> fst1, Fst<W> fst2, ComposeConfig config, ComposeFilterFactory<W, FS> filterFactory) {
        this.fst1 = Objects.requireNonNull(fst1, "fst1");
        this.fst2 = Objects.requireNonNull(fst2, "fst2");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(filterFactory, "filterFactory");
        if (!fst1.semiring().equals(fst2.semiring())) {
            throw new ConstructionException(
                    "cannot compose over different semirings: "
                            + fst1.semiring().name() + " vs " + fst2.semiring().name()
            );
        }
        this.semiring = fst1.semiring();
        this.matchInput = resolveMatchInput(config.getMatchType());
        this.filter = filterFactory.create(fst1, fst2);
        if (this.filter == null) {
            throw new ConstructionException("filter factory returned no filter");
        }
    }

    Semiring<W> semiring() {
        return semiring;
    }

    int start() {
        if (!cache.hasStart()) {
            cache.setStart(computeStart());
        }
        return cache.start();
    }

    List<Arc<W>> arcs(int state) {
        stateTable.findTuple(state);
        if (!cache.hasArcs(state)) {
            cache.setArcs(state, expand(state));
        }
        return cache.arcs(state);
    }

    W finalWeight(int state) {
        stateTable.findTuple(state);
        if (!cache.hasFinal(state)) {
            cache.setFinal(state, computeFinal(state));
        }
        return cache.finalWeight(state);
    }

    int numKnownStates() {
        return stateTable.size();
    }

    int numExpandedStates() {
        return cache.expandedStates();
    }

    ComposeStateTuple<FS> tuple(int state) {
        return stateTable.findTuple(state);
    }

    private int computeStart() {
        int s1 = fst1.start();
        if (s1 == Fst.NO_STATE) {
            return Fst.NO_STATE;
        }
        int s2 = fst2.start();
        if (s2 == Fst.NO_STATE) {
            return Fst.NO_STATE;
        }
        return stateTable.findId(new ComposeStateTuple<>(filter.start(), s1, s2));
    }

    private List<Arc<W>> expand(int state) {
        ComposeStateTuple<FS> tuple = stateTable.findTuple(state);
        int s1 = tuple.s1();
        int s2 = tuple.s2();
        filter.setState(s1, s2, tuple.filterState());
        List<Arc<W>> arcs = new ArrayList<>();
        if (matchInput) {
            orderedExpand(fst1, s1, filter.matcher2(), s2, arcs);
        } else {
            orderedExpand(fst2, s2, filter.matcher1(), s1, arcs);
        }
        return arcs;
    }

    private void orderedExpand(Fst<W> driving, int drivingState, MatcherSlot<W> probeSlot, int probeState, List<Arc<W>> out) {
        try (MatcherSlot.Loan<W> loan = probeSlot.borrow()) {
            Matcher<W> matcher = loan.matcher();
            Arc<W> loop = matchInput
                    ? new Arc<>(Arc.EPSILON, Arc.NO_LABEL, semiring.one(), drivingState)
                    : new Arc<>(Arc.NO_LABEL, Arc.EPSILON, semiring.one(), drivingState);
            matchArc(matcher, probeState, loop, out);
            for (Arc<W> arc : driving.arcs(drivingState)) {
                matchArc(matcher, probeState, arc, out);
            }
        }
    }

    private void matchArc(Matcher<W> matcher, int probeState, Arc<W> drivingArc, List<Arc<W>> out) {
        int label = matchInput ? drivingArc.olabel() : drivingArc.ilabel();
        Iterator<Arc<W>> partners = matcher.iterate(probeState, label);
        while (partners.hasNext()) {
            Arc<W> partner = partners.next();
            Arc<W> arc1 = matchInput ? drivingArc : partner;
            Arc<W> arc2 = matchInput ? partner : drivingArc;
            FS next = filter.filterArc(arc1, arc2);
            if (!next.isNoState()) {
                out.add(composeArc(arc1, arc2, next));
            }
        }
    }

    private Arc<W> composeArc(Arc<W> arc1, Arc<W> arc2, FS filterState) {
        W weight = semiring.times(arc1.weight(), arc2.weight());
        int nextState = stateTable.findId(new ComposeStateTuple<>(filterState, arc1.nextState(), arc2.nextState()));
        return new Arc<>(arc1.ilabel(), arc2.olabel(), weight, nextState);
    }

    private W computeFinal(int state) {
        ComposeStateTuple<FS> tuple = stateTable.findTuple(state);
        W final1 = finalWeightThrough(filter.matcher1(), tuple.s1());
        if (final1 == null) {
            return null;
        }
        W final2 = finalWeightThrough(filter.matcher2(), tuple.s2());
        if (final2 == null) {
            return null;
        }
        filter.setState(tuple.s1(), tuple.s2(), tuple.filterState());
        FinalWeights<W> adjusted = filter.filterFinal(final1, final2);
        return semiring.times(adjusted.weight1(), adjusted.weight2());
    }

    private W finalWeightThrough(MatcherSlot<W> slot, int state) {
        try (MatcherSlot.Loan<W> loan = slot.borrow()) {
            return loan.matcher().finalWeight(state);
        }
    }

    private static boolean resolveMatchInput(MatchType matchType) {
        if (matchType == MatchType.MATCH_INPUT) {
            return true;
        }
        if (matchType == MatchType.MATCH_OUTPUT) {
            return false;
        }
        throw new ConstructionException("composition cannot match on " + matchType);
    }
}
