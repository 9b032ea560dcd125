package SFC.Registry;

import java.util.BitSet;

/**
 * Maps explored states, encoded as bit sets, to the identifiers of the graph being built.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Look up a state.
     * @param key - encoded state
     * @return identifier of a registered state that covers {@code key}, or MISSING_ELEMENT
     */
    int get(BitSet key);

    /**
     * Register a new state.
     * @param key - encoded state; the registry keeps its own copy
     * @param stateID - identifier assigned by the caller
     */
    void put(BitSet key, int stateID);

    int size();
}
