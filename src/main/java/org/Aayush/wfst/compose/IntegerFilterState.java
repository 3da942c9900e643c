package org.Aayush.wfst.compose;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Filter state holding a single small integer. {@code -1} is the reject marker and
 * {@code 0} the canonical start value.
 */
@Value
@Accessors(fluent = true)
public class IntegerFilterState implements FilterState {
    public static final IntegerFilterState NO_STATE = new IntegerFilterState(-1);
    public static final IntegerFilterState ZERO = new IntegerFilterState(0);
    public static final IntegerFilterState ONE = new IntegerFilterState(1);

    int value;

    /**
     * Canonical start value.
     */
    public IntegerFilterState() {
        this(0);
    }

    public IntegerFilterState(int value) {
        if (value < -1) {
            throw new IllegalArgumentException("filter state must be >= -1, got " + value);
        }
        this.value = value;
    }

    public static IntegerFilterState of(int value) {
        switch (value) {
            case -1:
                return NO_STATE;
            case 0:
                return ZERO;
            case 1:
                return ONE;
            default:
                return new IntegerFilterState(value);
        }
    }

    @Override
    public boolean isNoState() {
        return value == -1;
    }
}
