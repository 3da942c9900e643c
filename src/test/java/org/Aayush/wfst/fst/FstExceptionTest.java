package org.Aayush.wfst.fst;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FstException Tests")
class FstExceptionTest {

    @Test
    @DisplayName("Three-arg constructor preserves reason code, message prefix, and cause")
    void testThreeArgConstructor() {
        IllegalStateException cause = new IllegalStateException("boom");
        FstException ex = new FstException("TEST_REASON", "details", cause);

        assertEquals("TEST_REASON", ex.reasonCode());
        assertTrue(ex.getMessage().contains("[TEST_REASON] details"));
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank reason code is rejected deterministically")
    void testBlankReasonCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FstException(" ", "details"));
    }

    @Test
    @DisplayName("Each failure family carries its own reason code")
    void testFamilies() {
        assertEquals(ConstructionException.REASON_CODE, new ConstructionException("x").reasonCode());
        assertEquals(
                AlgebraicPreconditionException.REASON_CODE,
                new AlgebraicPreconditionException("x").reasonCode()
        );
        assertEquals(InvalidStateException.REASON_CODE, InvalidStateException.unknownState(3, 2).reasonCode());
        ArithmeticFailureException arithmetic = new ArithmeticFailureException("x", new ArithmeticException("overflow"));
        assertEquals(ArithmeticFailureException.REASON_CODE, arithmetic.reasonCode());
        assertInstanceOf(FstException.class, arithmetic);
    }
}
