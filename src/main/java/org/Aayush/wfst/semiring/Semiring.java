package org.Aayush.wfst.semiring;

import java.util.Objects;
import java.util.Set;

/**
 * Algebraic weight structure scoring paths through an automaton.
 *
 * <p>{@code plus} is associative and commutative with identity {@link #zero()}; {@code times}
 * is associative with identity {@link #one()}. Algorithms never assume {@code times} is
 * commutative and always multiply in path order.</p>
 *
 * <p>Implementations are stateless and safe to share.</p>
 *
 * @param <W> weight value type.
 */
public interface Semiring<W> {

    W zero();

    W one();

    W plus(W a, W b);

    W times(W a, W b);

    /**
     * Maps a weight into the semiring used on a time-reversed automaton.
     * Commutative semirings return the weight unchanged.
     */
    W reverse(W weight);

    /**
     * Declared algebraic properties.
     */
    Set<SemiringProperty> properties();

    default boolean hasProperty(SemiringProperty property) {
        return properties().contains(property);
    }

    default boolean equal(W a, W b) {
        return Objects.equals(a, b);
    }

    /**
     * Equality up to {@code delta}; exact semirings ignore the tolerance.
     */
    default boolean approxEqual(W a, W b, double delta) {
        return equal(a, b);
    }

    /**
     * Natural order induced by {@code plus}: {@code a < b} iff {@code a != b} and
     * {@code plus(a, b) == a}. Only meaningful for idempotent semirings.
     */
    default boolean naturalLess(W a, W b) {
        return !equal(a, b) && equal(plus(a, b), a);
    }

    default boolean isZero(W weight) {
        return equal(weight, zero());
    }

    /**
     * Short stable name used in diagnostics.
     */
    String name();
}
