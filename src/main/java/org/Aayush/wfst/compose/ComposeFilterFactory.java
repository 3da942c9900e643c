package org.Aayush.wfst.compose;

import org.Aayush.wfst.fst.Fst;

/**
 * Creates a filter (and with it, its matchers) for one composition.
 *
 * @param <W>  weight type.
 * @param <FS> filter state type.
 */
@FunctionalInterface
public interface ComposeFilterFactory<W, FS extends FilterState> {

    ComposeFilter<W, FS> create(Fst<W> fst1, Fst<W> fst2);
}
