package SFC.CutPoints;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DominatorsTest {

  private static IntList[] preds(int n, int[][] edges) {
    IntList[] preds = new IntList[n];
    for (int k = 0; k < n; k++) {
      preds[k] = new IntArrayList();
    }
    for (int[] e : edges) {
      preds[e[1]].add(e[0]);
    }
    return preds;
  }

  @Test
  void testDiamond() {
    // 0 -> 1, 0 -> 2, 1 -> 3, 2 -> 3, 3 -> 4
    IntList[] preds = preds(5, new int[][]{{0, 1}, {0, 2}, {1, 3}, {2, 3}, {3, 4}});
    int[] idom = Dominators.immediateDominators(preds, new int[]{0, 2, 1, 3, 4});

    Assertions.assertArrayEquals(new int[]{0, 0, 0, 0, 3}, idom);
  }

  @Test
  void testUnreachableNode() {
    IntList[] preds = preds(3, new int[][]{{0, 1}, {2, 1}});
    int[] idom = Dominators.immediateDominators(preds, new int[]{0, 1});

    Assertions.assertEquals(0, idom[1]);
    Assertions.assertEquals(Dominators.UNDEFINED, idom[2]);
  }
}
