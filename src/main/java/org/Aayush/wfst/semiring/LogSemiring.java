package org.Aayush.wfst.semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Log semiring over negative log probabilities:
 * {@code plus(a, b) = -log(e^-a + e^-b)}, {@code times = +}.
 */
public final class LogSemiring implements Semiring<Double> {
    public static final LogSemiring INSTANCE = new LogSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
            SemiringProperty.LEFT_SEMIRING,
            SemiringProperty.RIGHT_SEMIRING,
            SemiringProperty.COMMUTATIVE
    ));

    private static final Double ZERO = Double.POSITIVE_INFINITY;
    private static final Double ONE = 0.0d;

    private LogSemiring() {
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
        if (a == Double.POSITIVE_INFINITY) {
            return b;
        }
        if (b == Double.POSITIVE_INFINITY) {
            return a;
        }
        double min = Math.min(a, b);
        double max = Math.max(a, b);
        return min - Math.log1p(Math.exp(min - max));
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
    public String name() {
        return "log";
    }
}
