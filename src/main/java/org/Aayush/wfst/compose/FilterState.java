package org.Aayush.wfst.compose;

/**
 * Auxiliary composition state used to disambiguate epsilon interleavings.
 *
 * <p>Implementations are small immutable values with value equality; they key the product
 * state table together with the two component states.</p>
 */
public interface FilterState {

    /**
     * @return true for the distinguished "reject" marker.
     */
    boolean isNoState();
}
