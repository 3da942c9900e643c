package org.Aayush.wfst.fst;

/**
 * Predicate deciding which arcs an algorithm may follow.
 *
 * @param <W> weight type.
 */
@FunctionalInterface
public interface ArcFilter<W> {

    boolean keep(Arc<W> arc);

    static <W> ArcFilter<W> acceptAll() {
        return arc -> true;
    }

    /**
     * Keeps arcs that are epsilon on both sides.
     */
    static <W> ArcFilter<W> epsilon() {
        return arc -> arc.ilabel() == Arc.EPSILON && arc.olabel() == Arc.EPSILON;
    }

    static <W> ArcFilter<W> inputEpsilon() {
        return arc -> arc.ilabel() == Arc.EPSILON;
    }

    static <W> ArcFilter<W> outputEpsilon() {
        return arc -> arc.olabel() == Arc.EPSILON;
    }
}
