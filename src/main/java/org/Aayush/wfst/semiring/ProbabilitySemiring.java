package org.Aayush.wfst.semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Real (probability) semiring over doubles: {@code plus = +}, {@code times = x}.
 */
public final class ProbabilitySemiring implements Semiring<Double> {
    public static final ProbabilitySemiring INSTANCE = new ProbabilitySemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
            SemiringProperty.LEFT_SEMIRING,
            SemiringProperty.RIGHT_SEMIRING,
            SemiringProperty.COMMUTATIVE
    ));

    private static final Double ZERO = 0.0d;
    private static final Double ONE = 1.0d;

    private ProbabilitySemiring() {
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
        return a + b;
    }

    @Override
    public Double times(Double a, Double b) {
        return a * b;
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
        return Math.abs(a - b) <= delta;
    }

    @Override
    public String name() {
        return "probability";
    }
}
