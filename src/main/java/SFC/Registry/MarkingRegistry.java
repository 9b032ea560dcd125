package SFC.Registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Exact registry: a key is covered only by an equal key.
 * Identifiers are expected to be dense, so the keys are also retrievable by identifier.
 */
public class MarkingRegistry implements Registry {
    private final Object2IntMap<BitSet> key2Id;
    private final List<BitSet> id2Key;

    public MarkingRegistry() {
        this.key2Id = new Object2IntOpenHashMap<>();
        this.key2Id.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.id2Key = new ArrayList<>();
    }

    @Override
    public int get(BitSet key) {
        return key2Id.getInt(key);
    }

    @Override
    public void put(BitSet key, int stateID) {
        BitSet copy = (BitSet) key.clone();
        this.key2Id.put(copy, stateID);
        while (id2Key.size() <= stateID) {
            id2Key.add(null);
        }
        id2Key.set(stateID, copy);
    }

    /** Copy of the key registered as {@code stateID}. */
    public BitSet key(int stateID) {
        return (BitSet) id2Key.get(stateID).clone();
    }

    @Override
    public int size() {
        return key2Id.size();
    }

    @Override
    public String toString() {
        return "MarkingRegistry(" + size() + ")";
    }
}
