package org.Aayush.wfst.semiring;

import org.Aayush.wfst.fst.ArithmeticFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Semiring Tests")
class SemiringTest {

    @Nested
    @DisplayName("Tropical")
    class TropicalTests {
        private final TropicalSemiring semiring = TropicalSemiring.INSTANCE;

        @Test
        @DisplayName("plus is min, times is addition")
        void testArithmetic() {
            assertEquals(2.0d, semiring.plus(2.0d, 3.0d));
            assertEquals(5.0d, semiring.times(2.0d, 3.0d));
            assertEquals(3.0d, semiring.plus(semiring.zero(), 3.0d));
            assertEquals(3.0d, semiring.times(semiring.one(), 3.0d));
        }

        @Test
        @DisplayName("zero annihilates times")
        void testZeroAnnihilates() {
            assertTrue(semiring.isZero(semiring.times(semiring.zero(), -7.0d)));
            assertTrue(semiring.isZero(semiring.times(4.0d, semiring.zero())));
        }

        @Test
        @DisplayName("Declares idempotent and path properties")
        void testProperties() {
            assertTrue(semiring.hasProperty(SemiringProperty.RIGHT_SEMIRING));
            assertTrue(semiring.hasProperty(SemiringProperty.IDEMPOTENT));
            assertTrue(semiring.hasProperty(SemiringProperty.PATH));
            assertTrue(semiring.naturalLess(1.0d, 2.0d));
            assertFalse(semiring.naturalLess(2.0d, 2.0d));
        }

        @Test
        @DisplayName("approxEqual honours delta but not across infinity")
        void testApproxEqual() {
            assertTrue(semiring.approxEqual(1.0d, 1.0d + 1e-9, 1e-6));
            assertFalse(semiring.approxEqual(1.0d, 1.1d, 1e-6));
            assertFalse(semiring.approxEqual(semiring.zero(), 1e300, 1e-6));
        }
    }

    @Nested
    @DisplayName("Log and Probability")
    class RealTests {

        @Test
        @DisplayName("Log plus is -log(e^-a + e^-b)")
        void testLogPlus() {
            LogSemiring semiring = LogSemiring.INSTANCE;
            double expected = -Math.log(Math.exp(-1.0d) + Math.exp(-2.0d));
            assertEquals(expected, semiring.plus(1.0d, 2.0d), 1e-12);
            assertEquals(2.0d, semiring.plus(semiring.zero(), 2.0d));
            assertFalse(semiring.hasProperty(SemiringProperty.IDEMPOTENT));
        }

        @Test
        @DisplayName("Probability uses ordinary arithmetic")
        void testProbability() {
            ProbabilitySemiring semiring = ProbabilitySemiring.INSTANCE;
            assertEquals(0.75d, semiring.plus(0.5d, 0.25d));
            assertEquals(0.125d, semiring.times(0.5d, 0.25d));
            assertFalse(semiring.hasProperty(SemiringProperty.PATH));
        }
    }

    @Nested
    @DisplayName("Integer")
    class IntegerTests {
        private final IntegerSemiring semiring = IntegerSemiring.INSTANCE;

        @Test
        @DisplayName("Counts paths with ordinary arithmetic")
        void testArithmetic() {
            assertEquals(7L, semiring.plus(3L, 4L));
            assertEquals(12L, semiring.times(3L, 4L));
            assertFalse(semiring.hasProperty(SemiringProperty.IDEMPOTENT));
        }

        @Test
        @DisplayName("Overflow surfaces as ArithmeticFailureException")
        void testOverflow() {
            ArithmeticFailureException plus = assertThrows(
                    ArithmeticFailureException.class,
                    () -> semiring.plus(Long.MAX_VALUE, 1L)
            );
            assertEquals(ArithmeticFailureException.REASON_CODE, plus.reasonCode());
            assertInstanceOf(ArithmeticException.class, plus.getCause());

            assertThrows(ArithmeticFailureException.class, () -> semiring.times(Long.MAX_VALUE, 2L));
        }
    }

    @Test
    @DisplayName("Boolean is or/and")
    void testBoolean() {
        BooleanSemiring semiring = BooleanSemiring.INSTANCE;
        assertTrue(semiring.plus(false, true));
        assertFalse(semiring.times(true, false));
        assertTrue(semiring.isZero(false));
        assertTrue(semiring.hasProperty(SemiringProperty.PATH));
    }
}
