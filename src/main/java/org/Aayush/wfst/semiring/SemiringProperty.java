package org.Aayush.wfst.semiring;

/**
 * Algebraic properties a semiring may declare.
 *
 * <p>{@code LEFT_SEMIRING} and {@code RIGHT_SEMIRING} declare left and right distributivity of
 * {@code times} over {@code plus}. {@code PATH} means {@code plus(a, b)} always equals
 * {@code a} or {@code b}, so partial sums form an improvement order.</p>
 */
public enum SemiringProperty {
    LEFT_SEMIRING,
    RIGHT_SEMIRING,
    COMMUTATIVE,
    IDEMPOTENT,
    PATH
}
