package org.Aayush.wfst.semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tropical semiring over doubles: {@code plus = min}, {@code times = +},
 * {@code zero = +inf}, {@code one = 0}.
 */
public final class TropicalSemiring implements Semiring<Double> {
    public static final TropicalSemiring INSTANCE = new TropicalSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
            SemiringProperty.LEFT_SEMIRING,
            SemiringProperty.RIGHT_SEMIRING,
            SemiringProperty.COMMUTATIVE,
            SemiringProperty.IDEMPOTENT,
            SemiringProperty.PATH
    ));

    private static final Double ZERO = Double.POSITIVE_INFINITY;
    private static final Double ONE = 0.0d;

    private TropicalSemiring() {
    }

    @Override
    public Double zero() {
        return ZERO;
    }

    @Override
    public Double one() {
        return ONE;
    }

    @Override
    public Double plus(Double a, Double b) {
        return a <= b ? a : b;
    }

    @Override
    public Double times(Double a, Double b) {
        if (a == Double.POSITIVE_INFINITY || b == Double.POSITIVE_INFINITY) {
            return ZERO;
        }
        return a + b;
    }

    @Override
    public Double reverse(Double weight) {
        return weight;
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public boolean equal(Double a, Double b) {
        return Double.compare(a, b) == 0;
    }

    @Override
    public boolean approxEqual(Double a, Double b, double delta) {
        if (a.isInfinite() || b.isInfinite()) {
            return equal(a, b);
        }
        return Math.abs(a - b) <= delta;
    }

    @Override
    public boolean naturalLess(Double a, Double b) {
        return a < b;
    }

    @Override
    public String name() {
        return "tropical";
    }
}
