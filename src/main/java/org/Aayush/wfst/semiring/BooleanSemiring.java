package org.Aayush.wfst.semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Boolean semiring: {@code plus = or}, {@code times = and}. Shortest distance under it is
 * plain reachability.
 */
public final class BooleanSemiring implements Semiring<Boolean> {
    public static final BooleanSemiring INSTANCE = new BooleanSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
            SemiringProperty.LEFT_SEMIRING,
            SemiringProperty.RIGHT_SEMIRING,
            SemiringProperty.COMMUTATIVE,
            SemiringProperty.IDEMPOTENT,
            SemiringProperty.PATH
    ));

    private BooleanSemiring() {
    }

    @Override
    public Boolean zero() {
        return Boolean.FALSE;
    }

    @Override
    public Boolean one() {
        return Boolean.TRUE;
    }

    @Override
    public Boolean plus(Boolean a, Boolean b) {
        return a || b;
    }

    @Override
    public Boolean times(Boolean a, Boolean b) {
        return a && b;
    }

    @Override
    public Boolean reverse(Boolean weight) {
        return weight;
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public String name() {
        return "boolean";
    }
}
