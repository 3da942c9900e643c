package org.Aayush.wfst.fst;

/**
 * Thrown when a semiring lacks a property required by the requested algorithm variant.
 */
public final class AlgebraicPreconditionException extends FstException {
    public static final String REASON_CODE = "WFST_ALGEBRAIC_PRECONDITION_VIOLATED";

    public AlgebraicPreconditionException(String message) {
        super(REASON_CODE, message);
    }
}
