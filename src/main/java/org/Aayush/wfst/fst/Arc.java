package org.Aayush.wfst.fst;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Immutable weighted transition {@code (ilabel, olabel, weight, nextState)}.
 *
 * <p>Label {@link #EPSILON} is the empty symbol. {@link #NO_LABEL} never appears on stored
 * arcs; matchers use it to mark the implicit "stay in place" loop of one side of a
 * composition, which is distinct from an epsilon move.</p>
 *
 * @param <W> weight type.
 */
@Value
@Accessors(fluent = true)
public class Arc<W> {
    public static final int EPSILON = 0;
    public static final int NO_LABEL = -1;

    int ilabel;
    int olabel;
    W weight;
    int nextState;
}
