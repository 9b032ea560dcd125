package SFC.CutPoints;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Iterative dominator computation of Cooper, Harvey and Kennedy,
 * "A Simple, Fast Dominance Algorithm".
 */
final class Dominators {
    static final int UNDEFINED = -1;

    private Dominators() {}

    /**
     * Immediate dominators of a rooted graph.
     * @param preds - predecessor lists, indexed by node
     * @param rpo - nodes reachable from the root in reverse postorder; {@code rpo[0]} is the root
     * @return idom per node; the root is its own immediate dominator, unreachable nodes are UNDEFINED
     */
    static int[] immediateDominators(IntList[] preds, int[] rpo) {
        final int n = preds.length;
        final int[] order = new int[n]; // node -> position in rpo
        Arrays.fill(order, UNDEFINED);
        for (int k = 0; k < rpo.length; k++) {
            order[rpo[k]] = k;
        }

        final int[] idom = new int[n];
        Arrays.fill(idom, UNDEFINED);
        final int root = rpo[0];
        idom[root] = root;

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int k = 1; k < rpo.length; k++) {
                final int b = rpo[k];
                int newIdom = UNDEFINED;
                for (int p : preds[b]) {
                    if (idom[p] == UNDEFINED) {
                        continue;
                    }
                    newIdom = newIdom == UNDEFINED ? p : intersect(p, newIdom, idom, order);
                }
                if (newIdom != UNDEFINED && idom[b] != newIdom) {
                    idom[b] = newIdom;
                    changed = true;
                }
            }
        }
        return idom;
    }

    private static int intersect(int b1, int b2, int[] idom, int[] order) {
        int finger1 = b1;
        int finger2 = b2;
        while (finger1 != finger2) {
            while (order[finger1] > order[finger2]) {
                finger1 = idom[finger1];
            }
            while (order[finger2] > order[finger1]) {
                finger2 = idom[finger2];
            }
        }
        return finger1;
    }
}
