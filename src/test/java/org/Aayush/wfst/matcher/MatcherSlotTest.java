package org.Aayush.wfst.matcher;

import org.Aayush.wfst.testutil.FstFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatcherSlot Tests")
class MatcherSlotTest {

    private MatcherSlot<Double> slot;

    @BeforeEach
    void setUp() {
        slot = new MatcherSlot<>(
                "matcher2",
                new IndexedMatcher<>(FstFixtures.epsilonLoopFst(), MatchType.MATCH_INPUT)
        );
    }

    @Test
    @DisplayName("Loan grants access and returns the matcher on close")
    void testBorrowAndReturn() {
        try (MatcherSlot.Loan<Double> loan = slot.borrow()) {
            assertTrue(slot.isOnLoan());
            assertEquals(MatchType.MATCH_INPUT, loan.matcher().matchType());
        }
        assertFalse(slot.isOnLoan());
        assertEquals(MatchType.MATCH_INPUT, slot.matchType());
    }

    @Test
    @DisplayName("Second borrow while on loan fails fast")
    void testDoubleBorrow() {
        try (MatcherSlot.Loan<Double> ignored = slot.borrow()) {
            IllegalStateException ex = assertThrows(IllegalStateException.class, slot::borrow);
            assertTrue(ex.getMessage().contains("matcher2"));
        }
        assertDoesNotThrow(() -> slot.borrow().close());
    }

    @Test
    @DisplayName("Closed loan no longer hands out the matcher")
    void testClosedLoan() {
        MatcherSlot.Loan<Double> loan = slot.borrow();
        loan.close();
        loan.close();

        assertThrows(IllegalStateException.class, loan::matcher);
        assertFalse(slot.isOnLoan());
    }
}
