package org.Aayush.wfst.compose;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.semiring.Semiring;

import java.util.List;

/**
 * Lazy composition of two automata.
 * <p>
 * The product is discovered on demand: a state's arcs and final weight are computed the first
 * time they are queried and served from cache afterwards. Only states reachable through
 * queried arcs are ever created, so callers bound the work by bounding what they read.
 * </p>
 * <p>
 * The input automata are borrowed for the lifetime of this object and must not change.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 *
 * @param <W> weight type.
 */
public final class ComposeFst<W> implements Fst<W> {

    private final ComposeFstImpl<W, ?> impl;

    private ComposeFst(ComposeFstImpl<W, ?> impl) {
        this.impl = impl;
    }

    /**
     * Composes with the alternating-sequence epsilon filter and default options.
     */
    public static <W> ComposeFst<W> compose(Fst<W> fst1, Fst<W> fst2) {
        return compose(fst1, fst2, ComposeConfig.defaults());
    }

    /**
     * Composes with the alternating-sequence epsilon filter.
     */
    public static <W> ComposeFst<W> compose(Fst<W> fst1, Fst<W> fst2, ComposeConfig config) {
        return compose(fst1, fst2, config, AltSequenceComposeFilter.factory());
    }

    /**
     * Composes with a caller-supplied filter policy.
     *
     * @throws org.Aayush.wfst.fst.ConstructionException when the filter, its matchers or the
     *                                                   match direction cannot be set up.
     */
    public static <W, FS extends FilterState> ComposeFst<W> compose(
            Fst<W> fst1,
            Fst<W> fst2,
            ComposeConfig config,
            ComposeFilterFactory<W, FS> filterFactory
    ) {
        return new ComposeFst<>(new ComposeFstImpl<>(fst1, fst2, config, filterFactory));
    }

    @Override
    public Semiring<W> semiring() {
        return impl.semiring();
    }

    @Override
    public int start() {
        return impl.start();
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        return impl.arcs(state);
    }

    @Override
    public W finalWeight(int state) {
        return impl.finalWeight(state);
    }

    /**
     * Component states {@code (filterState, s1, s2)} behind a product state.
     */
    public ComposeStateTuple<?> tuple(int state) {
        return impl.tuple(state);
    }

    /**
     * Number of product states discovered so far.
     */
    public int numKnownStates() {
        return impl.numKnownStates();
    }

    /**
     * Number of product states whose arcs have been computed.
     */
    public int numExpandedStates() {
        return impl.numExpandedStates();
    }

    @Override
    public String toString() {
        return "ComposeFst{" +
                "semiring=" + impl.semiring().name() +
                ", knownStates=" + impl.numKnownStates() +
                ", expandedStates=" + impl.numExpandedStates() +
                '}';
    }
}
