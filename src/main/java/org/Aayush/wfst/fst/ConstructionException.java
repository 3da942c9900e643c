package org.Aayush.wfst.fst;

/**
 * Thrown when a matcher, filter or lazy automaton cannot be built for the requested
 * match-direction combination.
 */
public final class ConstructionException extends FstException {
    public static final String REASON_CODE = "WFST_CONSTRUCTION_FAILED";

    public ConstructionException(String message) {
        super(REASON_CODE, message);
    }

    public ConstructionException(String message, Throwable cause) {
        super(REASON_CODE, message, cause);
    }
}
