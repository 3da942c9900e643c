package org.Aayush.wfst.matcher;

import org.Aayush.wfst.fst.ConstructionException;
import org.Aayush.wfst.fst.Fst;

/**
 * Creates matchers for a requested match direction.
 *
 * @param <W> weight type.
 */
@FunctionalInterface
public interface MatcherFactory<W> {

    /**
     * @throws ConstructionException when the factory cannot index {@code fst} in the
     *                               requested direction.
     */
    Matcher<W> create(Fst<W> fst, MatchType matchType);

    /**
     * Default factory backed by {@link IndexedMatcher}.
     */
    static <W> MatcherFactory<W> indexed() {
        return IndexedMatcher::new;
    }
}
