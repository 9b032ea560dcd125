package SFC.Registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;

import SFC.BitSetUtils;

/**
 * Subsumption registry over the visited sets of one subset construction.
 * A key is covered by any registered subset of it: whatever the larger set can match,
 * the smaller one already had to match. Only minimal sets are retained.
 */
public class AntichainRegistry implements Registry {
    private final List<BitSet> keys = new ArrayList<>();
    private final List<Integer> ids = new ArrayList<>();
    private int added;

    @Override
    public int get(BitSet key) {
        for (int k = 0; k < keys.size(); k++) {
            if (BitSetUtils.isSubset(keys.get(k), key)) {
                return ids.get(k);
            }
        }
        return MISSING_ELEMENT;
    }

    /**
     * Insert {@code key}, dropping every retained superset of it.
     * Callers should check {@link #get(BitSet)} first; a covered key is not inserted.
     */
    @Override
    public void put(BitSet key, int stateID) {
        if (get(key) != MISSING_ELEMENT) {
            return;
        }
        Iterator<BitSet> keyIt = keys.iterator();
        Iterator<Integer> idIt = ids.iterator();
        while (keyIt.hasNext()) {
            idIt.next();
            if (BitSetUtils.isSubset(key, keyIt.next())) {
                keyIt.remove();
                idIt.remove();
            }
        }
        keys.add((BitSet) key.clone());
        ids.add(stateID);
        added++;
    }

    /** Number of retained, pairwise incomparable sets. */
    @Override
    public int size() {
        return keys.size();
    }

    /** Number of sets ever inserted. */
    public int getInsertions() {
        return added;
    }

    @Override
    public String toString() {
        return "Antichain" + keys;
    }
}
