package org.Aayush.wfst.matcher;

import java.util.Objects;

/**
 * Single owner of a {@link Matcher} that hands out short-lived exclusive loans.
 * <p>
 * A composition filter owns its two matchers through slots; the composition orchestrator
 * borrows them for the duration of one lookup sweep:
 * </p>
 * <pre>{@code
 * try (MatcherSlot.Loan<W> loan = filter.matcher2().borrow()) {
 *     Iterator<Arc<W>> it = loan.matcher().iterate(state, label);
 *     ...
 * }
 * }</pre>
 * <p>
 * Borrowing a matcher that is already on loan is a programming error and fails fast with
 * {@link IllegalStateException}; it is never a recoverable condition.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 *
 * @param <W> weight type.
 */
public final class MatcherSlot<W> {

    private final Matcher<W> matcher;
    private final String name;
    private Loan<W> activeLoan;

    public MatcherSlot(String name, Matcher<W> matcher) {
        this.name = Objects.requireNonNull(name, "name");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    /**
     * Takes an exclusive loan on the matcher.
     *
     * @return loan to close once the caller is done with the matcher.
     * @throws IllegalStateException if the matcher is already on loan.
     */
    public Loan<W> borrow() {
        if (activeLoan != null) {
            throw new IllegalStateException("matcher " + name + " is already on loan");
        }
        activeLoan = new Loan<>(this);
        return activeLoan;
    }

    /**
     * @return true while a loan is outstanding.
     */
    public boolean isOnLoan() {
        return activeLoan != null;
    }

    public MatchType matchType() {
        return matcher.matchType();
    }

    private void release(Loan<W> loan) {
        if (activeLoan != loan) {
            throw new IllegalStateException("stale loan returned for matcher " + name);
        }
        activeLoan = null;
    }

    /**
     * Exclusive access handle; closing it returns the matcher to its slot.
     */
    public static final class Loan<W> implements AutoCloseable {
        private final MatcherSlot<W> slot;
        private boolean closed;

        private Loan(MatcherSlot<W> slot) {
            this.slot = slot;
        }

        /**
         * @throws IllegalStateException after the loan has been closed.
         */
        public Matcher<W> matcher() {
            if (closed) {
                throw new IllegalStateException("loan on matcher " + slot.name + " already returned");
            }
            return slot.matcher;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            slot.release(this);
        }
    }
}
