package org.Aayush.wfst.compose;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Identity of a product state before it is assigned an id: {@code (filterState, s1, s2)}.
 * Equal tuples always map to the same product state.
 */
@Value
@Accessors(fluent = true)
public class ComposeStateTuple<FS extends FilterState> {
    FS filterState;
    int s1;
    int s2;
}
