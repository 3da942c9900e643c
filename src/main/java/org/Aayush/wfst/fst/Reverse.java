package org.Aayush.wfst.fst;

import lombok.experimental.UtilityClass;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Time reversal of an automaton.
 */
@UtilityClass
public final class Reverse {

    /**
     * Builds the reversed automaton.
     * <p>
     * The result has one extra state: a synthetic start state {@code 0} with an epsilon arc,
     * weighted by the reversed final weight, to every formerly final state. Every original
     * state {@code s} becomes {@code s + 1}; every arc {@code p -> q} becomes {@code q + 1 -> p + 1}
     * with its weight reversed; the original start state becomes final with weight one.
     * </p>
     *
     * @param fst automaton to reverse.
     * @return reversed copy, empty when {@code fst} has no start state.
     */
    public static <W> VectorFst<W> reverse(ExpandedFst<W> fst) {
        Semiring<W> semiring = fst.semiring();
        VectorFst<W> reversed = new VectorFst<>(semiring);
        int start = fst.start();
        if (start == Fst.NO_STATE) {
            return reversed;
        }

        int n = fst.numStates();
        int superStart = reversed.addState();
        for (int s = 0; s < n; s++) {
            reversed.addState();
        }
        reversed.setStart(superStart);
        reversed.setFinal(start + 1, semiring.one());

        for (int s = 0; s < n; s++) {
            W finalWeight = fst.finalWeight(s);
            if (finalWeight != null) {
                reversed.addArc(superStart, Arc.EPSILON, Arc.EPSILON, semiring.reverse(finalWeight), s + 1);
            }
            for (Arc<W> arc : fst.arcs(s)) {
                reversed.addArc(
                        arc.nextState() + 1,
                        arc.ilabel(),
                        arc.olabel(),
                        semiring.reverse(arc.weight()),
                        s + 1
                );
            }
        }
        return reversed;
    }
}
