package org.Aayush.wfst.compose;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Pair of component final weights as adjusted by {@link ComposeFilter#filterFinal}.
 */
@Value(staticConstructor = "of")
@Accessors(fluent = true)
public class FinalWeights<W> {
    W weight1;
    W weight2;
}
