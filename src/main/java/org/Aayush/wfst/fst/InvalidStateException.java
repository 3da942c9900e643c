package org.Aayush.wfst.fst;

/**
 * Thrown on lookup of a state id that was never allocated.
 */
public final class InvalidStateException extends FstException {
    public static final String REASON_CODE = "WFST_INVALID_STATE";

    public InvalidStateException(String message) {
        super(REASON_CODE, message);
    }

    /**
     * Creates the standard "unknown state" failure.
     *
     * @param state offending id.
     * @param numStates number of states known at the time of the lookup.
     * @return exception ready to throw.
     */
    public static InvalidStateException unknownState(int state, int numStates) {
        return new InvalidStateException("state " + state + " out of bounds (known states: " + numStates + ")");
    }
}
