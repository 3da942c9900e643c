package org.Aayush.wfst.distance;

import lombok.Builder;
import lombok.Value;
import org.Aayush.wfst.fst.ArcFilter;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.queue.StateQueueFactory;
import org.Aayush.wfst.queue.StateQueues;

/**
 * Options for one shortest-distance engine.
 *
 * @param <W> weight type.
 */
@Value
@Builder
public class ShortestDistanceConfig<W> {
    public static final double DEFAULT_DELTA = 1.0e-6d;

    static final String PROP_DELTA = "wfst.shortestdistance.delta";

    /**
     * Arcs the search may follow; {@code null} accepts every arc.
     */
    ArcFilter<W> arcFilter;

    /**
     * Queue discipline; {@code null} selects {@link StateQueues#auto()}.
     */
    StateQueueFactory<W> queueFactory;

    /**
     * Source state; {@link Fst#NO_STATE} uses the automaton start state.
     */
    @Builder.Default
    int source = Fst.NO_STATE;

    /**
     * Stop as soon as the first final state is dequeued. Requires the path property.
     */
    boolean firstPath;

    /**
     * Convergence tolerance for approximate semirings. Overridable through the
     * {@code wfst.shortestdistance.delta} system property.
     */
    @Builder.Default
    double delta = readDelta();

    /**
     * Default options: all arcs, automatic queue, start state as source.
     */
    public static <W> ShortestDistanceConfig<W> defaults() {
        return ShortestDistanceConfig.<W>builder().build();
    }

    /**
     * @return configured filter, or accept-all.
     */
    public ArcFilter<W> resolvedArcFilter() {
        return arcFilter == null ? ArcFilter.acceptAll() : arcFilter;
    }

    /**
     * @return configured queue factory, or the automatic one.
     */
    public StateQueueFactory<W> resolvedQueueFactory() {
        return queueFactory == null ? StateQueues.auto() : queueFactory;
    }

    private static double readDelta() {
        String raw = System.getProperty(PROP_DELTA);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_DELTA;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            return Double.isFinite(parsed) && parsed >= 0.0d ? parsed : DEFAULT_DELTA;
        } catch (NumberFormatException ex) {
            return DEFAULT_DELTA;
        }
    }
}
