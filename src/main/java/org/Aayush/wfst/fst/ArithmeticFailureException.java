package org.Aayush.wfst.fst;

/**
 * Thrown when a semiring operation itself fails, for example on overflow.
 */
public final class ArithmeticFailureException extends FstException {
    public static final String REASON_CODE = "WFST_ARITHMETIC_FAILURE";

    public ArithmeticFailureException(String message) {
        super(REASON_CODE, message);
    }

    public ArithmeticFailureException(String message, Throwable cause) {
        super(REASON_CODE, message, cause);
    }
}
