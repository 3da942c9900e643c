package org.Aayush.wfst.distance;

import lombok.Builder;
import lombok.Value;
import org.Aayush.wfst.queue.QueueType;

/**
 * Immutable telemetry snapshot of one shortest-distance run.
 */
@Value
@Builder
public class ShortestDistanceStats {

    /**
     * Sequence number of the run within its engine.
     */
    int runId;

    int source;

    /**
     * Discipline the queue factory produced.
     */
    QueueType queueType;

    /**
     * States removed from the queue.
     */
    long dequeues;

    /**
     * Arcs examined after the arc filter.
     */
    long relaxations;

    /**
     * Relaxations that changed a distance estimate.
     */
    long improvements;

    /**
     * Distinct states touched by the run.
     */
    int touchedStates;

    /**
     * True when first-path mode stopped the run at a final state.
     */
    boolean stoppedEarly;
}
