package org.Aayush.wfst.compose;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.ConstructionException;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.matcher.MatchType;
import org.Aayush.wfst.matcher.Matcher;
import org.Aayush.wfst.matcher.MatcherFactory;
import org.Aayush.wfst.matcher.MatcherSlot;

import java.util.Objects;

/**
 * Alternating-sequence epsilon filter.
 * <p>
 * Keeps exactly one path through every epsilon interleaving: the right automaton takes its
 * solo epsilon moves first, then the left automaton takes its own, then the two advance
 * together on a matched non-epsilon pair. Filter state {@code 1} means "the left side has
 * advanced alone since the last synchronized move", which forbids further solo moves on the
 * right.
 * </p>
 * <p>
 * Solo moves are recognized by the implicit stay loop produced by the matchers: the staying
 * side carries {@link Arc#NO_LABEL} on its matched label.
 * </p>
 *
 * @param <W> weight type.
 */
public final class AltSequenceComposeFilter<W> implements ComposeFilter<W, IntegerFilterState> {

    private final Fst<W> fst2;
    private final MatcherSlot<W> matcher1;
    private final MatcherSlot<W> matcher2;

    private int s1 = Fst.NO_STATE;
    private int s2 = Fst.NO_STATE;
    private IntegerFilterState filterState = IntegerFilterState.NO_STATE;
    // only (non-final) input epsilons leave s2
    private boolean allEpsilon2;
    // no input epsilons leave s2
    private boolean noEpsilon2;

    /**
     * Creates the filter with {@link org.Aayush.wfst.matcher.IndexedMatcher}s.
     */
    public AltSequenceComposeFilter(Fst<W> fst1, Fst<W> fst2) {
        this(fst1, fst2, MatcherFactory.indexed());
    }

    /**
     * Creates the filter with matchers from {@code matcherFactory}.
     *
     * @throws ConstructionException when a matcher cannot be built.
     */
    public AltSequenceComposeFilter(Fst<W> fst1, Fst<W> fst2, MatcherFactory<W> matcherFactory) {
        Objects.requireNonNull(fst1, "fst1");
        this.fst2 = Objects.requireNonNull(fst2, "fst2");
        Objects.requireNonNull(matcherFactory, "matcherFactory");
        this.matcher1 = new MatcherSlot<>("matcher1", createMatcher(matcherFactory, fst1, MatchType.MATCH_OUTPUT));
        this.matcher2 = new MatcherSlot<>("matcher2", createMatcher(matcherFactory, fst2, MatchType.MATCH_INPUT));
    }

    /**
     * Factory for {@link ComposeFst} using the default matchers.
     */
    public static <W> ComposeFilterFactory<W, IntegerFilterState> factory() {
        return AltSequenceComposeFilter::new;
    }

    /**
     * Factory for {@link ComposeFst} using matchers from {@code matcherFactory}.
     */
    public static <W> ComposeFilterFactory<W, IntegerFilterState> factory(MatcherFactory<W> matcherFactory) {
        Objects.requireNonNull(matcherFactory, "matcherFactory");
        return (fst1, fst2) -> new AltSequenceComposeFilter<>(fst1, fst2, matcherFactory);
    }

    @Override
    public IntegerFilterState start() {
        return IntegerFilterState.ZERO;
    }

    @Override
    public void setState(int s1, int s2, IntegerFilterState filterState) {
        if (this.s1 == s1 && this.s2 == s2 && this.filterState.equals(filterState)) {
            return;
        }
        this.s1 = s1;
        this.s2 = s2;
        this.filterState = filterState;
        int numArcs2 = fst2.numArcs(s2);
        int numEpsilons2 = fst2.numInputEpsilons(s2);
        boolean final2 = fst2.isFinal(s2);
        this.allEpsilon2 = numArcs2 == numEpsilons2 && !final2;
        this.noEpsilon2 = numEpsilons2 == 0;
    }

    @Override
    public IntegerFilterState filterArc(Arc<W> arc1, Arc<W> arc2) {
        if (arc2.ilabel() == Arc.NO_LABEL) {
            // left advances alone on an output epsilon
            if (allEpsilon2) {
                return IntegerFilterState.NO_STATE;
            }
            return noEpsilon2 ? IntegerFilterState.ZERO : IntegerFilterState.ONE;
        }
        if (arc1.olabel() == Arc.NO_LABEL) {
            // right advances alone on an input epsilon
            return filterState.value() == 0 ? IntegerFilterState.ZERO : IntegerFilterState.NO_STATE;
        }
        if (arc1.olabel() == Arc.EPSILON) {
            return IntegerFilterState.NO_STATE;
        }
        return IntegerFilterState.ZERO;
    }

    @Override
    public FinalWeights<W> filterFinal(W weight1, W weight2) {
        return FinalWeights.of(weight1, weight2);
    }

    @Override
    public MatcherSlot<W> matcher1() {
        return matcher1;
    }

    @Override
    public MatcherSlot<W> matcher2() {
        return matcher2;
    }

    private static <W> Matcher<W> createMatcher(MatcherFactory<W> factory, Fst<W> fst, MatchType matchType) {
        Matcher<W> matcher = factory.create(fst, matchType);
        if (matcher == null) {
            throw new ConstructionException("matcher factory returned no matcher for " + matchType);
        }
        if (matcher.matchType() != matchType) {
            throw new ConstructionException(
                    "matcher factory built a " + matcher.matchType() + " matcher, expected " + matchType
            );
        }
        return matcher;
    }
}
