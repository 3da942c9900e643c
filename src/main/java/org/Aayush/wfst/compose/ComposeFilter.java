package org.Aayush.wfst.compose;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.matcher.MatcherSlot;

/**
 * Decides which pairs of matching arcs are legal during composition and how epsilon
 * ambiguity is resolved.
 * <p>
 * The filter owns both matchers ({@code matcher1} over the left automaton indexed on output
 * labels, {@code matcher2} over the right automaton indexed on input labels) and lends them
 * to the composition orchestrator through {@link MatcherSlot}s.
 * </p>
 *
 * @param <W>  weight type.
 * @param <FS> filter state type.
 */
public interface ComposeFilter<W, FS extends FilterState> {

    /**
     * Canonical initial filter state.
     */
    FS start();

    /**
     * Records the current {@code (s1, s2, filterState)} context. Calls with an unchanged
     * context must not recompute anything.
     */
    void setState(int s1, int s2, FS filterState);

    /**
     * Filters one candidate pair of arcs whose matching labels align.
     *
     * @param arc1 arc from the left automaton, or its implicit stay loop.
     * @param arc2 arc from the right automaton, or its implicit stay loop.
     * @return next filter state, or a state with {@link FilterState#isNoState()} to reject.
     */
    FS filterArc(Arc<W> arc1, Arc<W> arc2);

    /**
     * Adjusts the component final weights before their product is taken.
     */
    FinalWeights<W> filterFinal(W weight1, W weight2);

    MatcherSlot<W> matcher1();

    MatcherSlot<W> matcher2();
}
