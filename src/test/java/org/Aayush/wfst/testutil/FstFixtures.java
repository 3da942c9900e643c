package org.Aayush.wfst.testutil;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.IntegerSemiring;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.SemiringProperty;
import org.Aayush.wfst.semiring.TropicalSemiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Small hand-built automata shared across tests.
 */
public final class FstFixtures {
    public static final int A = 1;
    public static final int B = 2;
    public static final int C = 3;

    private FstFixtures() {
    }

    /**
     * Single-arc acceptor {@code 0 -label/weight-> 1}, state 1 final with weight one.
     */
    public static VectorFst<Double> tropicalAcceptor(int label, double weight) {
        VectorFst<Double> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
        int s0 = fst.addState();
        int s1 = fst.addState();
        fst.setStart(s0);
        fst.addArc(s0, label, label, weight, s1);
        fst.setFinal(s1, 0.0d);
        return fst;
    }

    /**
     * Start state with a weight-2 epsilon self-loop and a weight-1 {@code a:a} arc to a final state.
     */
    public static VectorFst<Double> epsilonLoopFst() {
        VectorFst<Double> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
        int s0 = fst.addState();
        int s1 = fst.addState();
        fst.setStart(s0);
        fst.addArc(s0, Arc.EPSILON, Arc.EPSILON, 2.0d, s0);
        fst.addArc(s0, A, A, 1.0d, s1);
        fst.setFinal(s1, 0.0d);
        return fst;
    }

    /**
     * Three states: {@code 0 -> 1} (18), {@code 0 -> 2} (21), {@code 1 -> 2} (55), counting weights.
     */
    public static VectorFst<Long> countingTriangle() {
        VectorFst<Long> fst = new VectorFst<>(IntegerSemiring.INSTANCE);
        int s0 = fst.addState();
        int s1 = fst.addState();
        int s2 = fst.addState();
        fst.setStart(s0);
        fst.addArc(s0, A, A, 18L, s1);
        fst.addArc(s0, B, B, 21L, s2);
        fst.addArc(s1, C, C, 55L, s2);
        fst.setFinal(s2, 1L);
        return fst;
    }

    /**
     * Tropical cycle {@code 0 -> 1 -> 2 -> 0} with positive weights plus a shortcut {@code 0 -> 2}.
     */
    public static VectorFst<Double> tropicalCycle() {
        VectorFst<Double> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
        int s0 = fst.addState();
        int s1 = fst.addState();
        int s2 = fst.addState();
        fst.setStart(s0);
        fst.addArc(s0, A, A, 1.0d, s1);
        fst.addArc(s1, B, B, 2.0d, s2);
        fst.addArc(s2, C, C, 4.0d, s0);
        fst.addArc(s0, C, C, 5.0d, s2);
        fst.setFinal(s2, 0.5d);
        return fst;
    }

    /**
     * Counting semiring that declares left distributivity only.
     */
    public static Semiring<Long> leftOnlySemiring() {
        return new LeftOnlySemiring();
    }

    /**
     * Read-only wrapper that counts {@link Fst#arcs(int)} calls.
     */
    public static final class CountingFst<W> implements Fst<W> {
        private final Fst<W> delegate;
        private int arcCalls;

        public CountingFst(Fst<W> delegate) {
            this.delegate = delegate;
        }

        public int arcCalls() {
            return arcCalls;
        }

        @Override
        public Semiring<W> semiring() {
            return delegate.semiring();
        }

        @Override
        public int start() {
            return delegate.start();
        }

        @Override
        public List<Arc<W>> arcs(int state) {
            arcCalls++;
            return delegate.arcs(state);
        }

        @Override
        public W finalWeight(int state) {
            return delegate.finalWeight(state);
        }
    }

    private static final class LeftOnlySemiring implements Semiring<Long> {
        private static final Set<SemiringProperty> PROPERTIES =
                Collections.unmodifiableSet(EnumSet.of(SemiringProperty.LEFT_SEMIRING));

        @Override
        public Long zero() {
            return 0L;
        }

        @Override
        public Long one() {
            return 1L;
        }

        @Override
        public Long plus(Long a, Long b) {
            return a + b;
        }

        @Override
        public Long times(Long a, Long b) {
            return a * b;
        }

        @Override
        public Long reverse(Long weight) {
            return weight;
        }

        @Override
        public Set<SemiringProperty> properties() {
            return PROPERTIES;
        }

        @Override
        public String name() {
            return "left-only";
        }
    }
}
