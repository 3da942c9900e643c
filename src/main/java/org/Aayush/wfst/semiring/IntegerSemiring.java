package org.Aayush.wfst.semiring;

import org.Aayush.wfst.fst.ArithmeticFailureException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Counting semiring over longs: {@code plus = +}, {@code times = x}, {@code zero = 0},
 * {@code one = 1}.
 *
 * <p>Both operations are overflow-checked and fail with {@link ArithmeticFailureException}
 * instead of wrapping around.</p>
 */
public final class IntegerSemiring implements Semiring<Long> {
    public static final IntegerSemiring INSTANCE = new IntegerSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
            SemiringProperty.LEFT_SEMIRING,
            SemiringProperty.RIGHT_SEMIRING,
            SemiringProperty.COMMUTATIVE
    ));

    private static final Long ZERO = 0L;
    private static final Long ONE = 1L;

    private IntegerSemiring() {
    }

    @Override
    public Long zero() {
        return ZERO;
    }

    @Override
    public Long one() {
        return ONE;
    }

    @Override
    public Long plus(Long a, Long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException ex) {
            throw new ArithmeticFailureException("integer plus overflow: " + a + " + " + b, ex);
        }
    }

    @Override
    public Long times(Long a, Long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException ex) {
            throw new ArithmeticFailureException("integer times overflow: " + a + " * " + b, ex);
        }
    }

    @Override
    public Long reverse(Long weight) {
        return weight;
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public String name() {
        return "integer";
    }
}
