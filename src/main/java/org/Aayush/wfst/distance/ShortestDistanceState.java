package org.Aayush.wfst.distance;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.fst.AlgebraicPreconditionException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.ArcFilter;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.queue.AutoQueue;
import org.Aayush.wfst.queue.QueueType;
import org.Aayush.wfst.queue.StateQueue;
import org.Aayush.wfst.queue.StateQueueFactory;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.SemiringProperty;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generalized single-source shortest-distance engine.
 * <p>
 * Computes, for a source state, the {@code plus}-sum of the weights of all paths from the source
 * to every reachable state. Valid for any right semiring; the queue discipline only affects how
 * much work is done, not the result.
 * </p>
 * <p>
 * Per-state bookkeeping ({@code distance}, {@code adder}, {@code radder}, {@code enqueued}) grows
 * lazily with the largest state id touched. {@code radder[s]} holds the weight mass added to
 * {@code s} since it was last dequeued; on dequeue it is relaxed along the outgoing arcs and reset
 * to zero, so repeated relaxations never resum the running total.
 * </p>
 * <p>
 * Every state is tagged with the run that last touched it. In retain mode the engine serves
 * several runs over the same automaton without clearing its arrays; a state is reset lazily the
 * first time a new run reaches it. Results of a run only expose states that run touched.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 *
 * @param <W> weight type.
 */
public final class ShortestDistanceState<W> {
    private static final Logger logger = Logger.getLogger(ShortestDistanceState.class.getName());
    private static final int NO_RUN = -1;

    private final Fst<W> fst;
    private final Semiring<W> semiring;
    private final ArcFilter<W> arcFilter;
    private final StateQueueFactory<W> queueFactory;
    private final boolean firstPath;
    private final double delta;
    private final int configuredSource;
    private final boolean retain;

    private final ObjectArrayList<W> distance = new ObjectArrayList<>();
    private final ObjectArrayList<W> adder = new ObjectArrayList<>();
    private final ObjectArrayList<W> radder = new ObjectArrayList<>();
    private final BooleanArrayList enqueued = new BooleanArrayList();
    // run id that last touched each state
    private final IntArrayList sources = new IntArrayList();

    private int nextRunId;
    private int currentRun = NO_RUN;
    private int touchedStates;
    private ShortestDistanceStats lastRunStats;

    /**
     * @param fst automaton to search; may be lazy.
     * @param config engine options.
     * @param retain keep arrays between runs and reset states lazily by run tag.
     */
    public ShortestDistanceState(Fst<W> fst, ShortestDistanceConfig<W> config, boolean retain) {
        this.fst = Objects.requireNonNull(fst, "fst");
        Objects.requireNonNull(config, "config");
        this.semiring = fst.semiring();
        this.arcFilter = config.resolvedArcFilter();
        this.queueFactory = config.resolvedQueueFactory();
        this.firstPath = config.isFirstPath();
        this.delta = config.getDelta();
        this.configuredSource = config.getSource();
        this.retain = retain;
    }

    /**
     * Runs from the configured source (the start state by default).
     */
    public List<W> shortestDistance() {
        return shortestDistance(configuredSource);
    }

    /**
     * Runs from {@code source}.
     *
     * @param source source state, or {@link Fst#NO_STATE} for the start state.
     * @return distance per state id; states the run did not reach read as zero. Empty when the
     * automaton has no start state.
     * @throws AlgebraicPreconditionException before any work when the semiring is not a right
     *                                        semiring, or lacks the path property in first-path mode.
     */
    public List<W> shortestDistance(int source) {
        checkPreconditions();
        int start = fst.start();
        if (start == Fst.NO_STATE) {
            return new ObjectArrayList<>();
        }
        int runSource = source == Fst.NO_STATE ? start : source;
        // fails fast on an unknown source
        fst.finalWeight(runSource);

        if (!retain) {
            distance.clear();
            adder.clear();
            radder.clear();
            enqueued.clear();
        }
        currentRun = nextRunId++;
        touchedStates = 0;

        StateQueue queue = queueFactory.create(fst, runSource, arcFilter, this::compareDistance);
        long dequeues = 0L;
        long relaxations = 0L;
        long improvements = 0L;
        boolean stoppedEarly = false;

        touch(runSource);
        W one = semiring.one();
        distance.set(runSource, one);
        adder.set(runSource, one);
        radder.set(runSource, one);
        enqueued.set(runSource, true);
        queue.enqueue(runSource);

        while (!queue.isEmpty()) {
            int state = queue.dequeue();
            dequeues++;
            if (firstPath && fst.isFinal(state)) {
                stoppedEarly = true;
                break;
            }
            enqueued.set(state, false);
            W r = radder.get(state);
            radder.set(state, semiring.zero());

            for (Arc<W> arc : fst.arcs(state)) {
                if (!arcFilter.keep(arc)) {
                    continue;
                }
                relaxations++;
                int next = arc.nextState();
                touch(next);
                W current = distance.get(next);
                W weight = semiring.times(r, arc.weight());
                if (semiring.approxEqual(current, semiring.plus(current, weight), delta)) {
                    continue;
                }
                improvements++;
                W accumulated = semiring.plus(adder.get(next), weight);
                adder.set(next, accumulated);
                distance.set(next, accumulated);
                radder.set(next, semiring.plus(radder.get(next), weight));
                if (!enqueued.getBoolean(next)) {
                    enqueued.set(next, true);
                    queue.enqueue(next);
                } else {
                    queue.update(next);
                }
            }
        }

        lastRunStats = ShortestDistanceStats.builder()
                .runId(currentRun)
                .source(runSource)
                .queueType(resolvedType(queue))
                .dequeues(dequeues)
                .relaxations(relaxations)
                .improvements(improvements)
                .touchedStates(touchedStates)
                .stoppedEarly(stoppedEarly)
                .build();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("shortest distance run " + lastRunStats);
        }
        return snapshot();
    }

    /**
     * Distance of {@code state} in the most recent run, zero when that run did not touch it.
     */
    public W distance(int state) {
        if (!touchedByCurrentRun(state)) {
            return semiring.zero();
        }
        return distance.get(state);
    }

    /**
     * @return telemetry of the most recent successful run, or {@code null} before the first one.
     */
    public ShortestDistanceStats lastRunStats() {
        return lastRunStats;
    }

    private void checkPreconditions() {
        if (!semiring.hasProperty(SemiringProperty.RIGHT_SEMIRING)) {
            throw new AlgebraicPreconditionException(
                    "shortest distance needs a right semiring, got " + semiring.name()
            );
        }
        if (firstPath && !semiring.hasProperty(SemiringProperty.PATH)) {
            throw new AlgebraicPreconditionException(
                    "first-path mode needs a semiring with the path property, got " + semiring.name()
            );
        }
    }

    /**
     * Grows the arrays to cover {@code state} and resets it on first touch by the current run.
     */
    private void touch(int state) {
        W zero = semiring.zero();
        while (distance.size() <= state) {
            distance.add(zero);
            adder.add(zero);
            radder.add(zero);
            enqueued.add(false);
        }
        while (sources.size() <= state) {
            sources.add(NO_RUN);
        }
        if (sources.getInt(state) != currentRun) {
            distance.set(state, zero);
            adder.set(state, zero);
            radder.set(state, zero);
            enqueued.set(state, false);
            sources.set(state, currentRun);
            touchedStates++;
        }
    }

    private boolean touchedByCurrentRun(int state) {
        if (state < 0 || state >= sources.size() || currentRun == NO_RUN) {
            return false;
        }
        return sources.getInt(state) == currentRun;
    }

    private List<W> snapshot() {
        int n = distance.size();
        ObjectArrayList<W> result = new ObjectArrayList<>(n);
        for (int s = 0; s < n; s++) {
            result.add(touchedByCurrentRun(s) ? distance.get(s) : semiring.zero());
        }
        return result;
    }

    private int compareDistance(int a, int b) {
        W da = distance.get(a);
        W db = distance.get(b);
        if (semiring.naturalLess(da, db)) {
            return -1;
        }
        if (semiring.naturalLess(db, da)) {
            return 1;
        }
        return Integer.compare(a, b);
    }

    private static QueueType resolvedType(StateQueue queue) {
        if (queue instanceof AutoQueue) {
            return ((AutoQueue) queue).selectedType();
        }
        return queue.queueType();
    }
}
