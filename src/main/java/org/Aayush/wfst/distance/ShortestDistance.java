package org.Aayush.wfst.distance;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.wfst.fst.ExpandedFst;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.Reverse;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.Semiring;

import java.util.List;

/**
 * Entry points for shortest-distance queries.
 *
 * <p>The shortest distance from {@code p} to {@code q} is the {@code plus}-sum of the weights of
 * all paths from {@code p} to {@code q}.</p>
 */
@UtilityClass
public final class ShortestDistance {

    /**
     * Forward distances from the start state with default options.
     */
    public static <W> List<W> shortestDistance(Fst<W> fst) {
        return shortestDistance(fst, ShortestDistanceConfig.defaults());
    }

    /**
     * Forward distances with explicit options.
     */
    public static <W> List<W> shortestDistance(Fst<W> fst, ShortestDistanceConfig<W> config) {
        return new ShortestDistanceState<>(fst, config, false).shortestDistance();
    }

    /**
     * Forward distances from the start state, or backward distances to the final states.
     * <p>
     * Backward mode runs the forward algorithm on {@link Reverse#reverse(ExpandedFst) the reversed
     * automaton}, drops its synthetic start state and maps every weight back through
     * {@link Semiring#reverse(Object)}. Entry {@code s} is then the sum over all paths from
     * {@code s} to a final state, each times its final weight.
     * </p>
     *
     * @return one entry per state in backward mode (zero when no final state is reachable).
     */
    public static <W> List<W> shortestDistance(ExpandedFst<W> fst, boolean reverse) {
        if (!reverse) {
            return shortestDistance(fst);
        }
        Semiring<W> semiring = fst.semiring();
        VectorFst<W> reversed = Reverse.reverse(fst);
        List<W> reversedDistance = shortestDistance(reversed);
        if (reversedDistance.isEmpty()) {
            return reversedDistance;
        }
        int n = fst.numStates();
        ObjectArrayList<W> distance = new ObjectArrayList<>(n);
        for (int s = 0; s < n; s++) {
            int reversedState = s + 1;
            W weight = reversedState < reversedDistance.size()
                    ? reversedDistance.get(reversedState)
                    : semiring.zero();
            distance.add(semiring.reverse(weight));
        }
        return distance;
    }

    /**
     * Sum of the weights of all successful paths: forward distance of each final state times
     * its final weight. Zero for an automaton without start state.
     * <p>
     * Requires a right semiring. There is no backward fallback for left-only semirings: reversed
     * weights stay in the same {@link Semiring}, so the reversed automaton declares the same
     * properties and would be rejected as well.
     * </p>
     *
     * @throws org.Aayush.wfst.fst.AlgebraicPreconditionException when the semiring does not
     *                                                             declare {@code RIGHT_SEMIRING}.
     */
    public static <W> W totalWeight(Fst<W> fst) {
        Semiring<W> semiring = fst.semiring();
        List<W> distance = shortestDistance(fst);
        W sum = semiring.zero();
        for (int s = 0; s < distance.size(); s++) {
            W d = distance.get(s);
            if (semiring.isZero(d)) {
                continue;
            }
            W finalWeight = fst.finalWeight(s);
            if (finalWeight != null) {
                sum = semiring.plus(sum, semiring.times(d, finalWeight));
            }
        }
        return sum;
    }
}
