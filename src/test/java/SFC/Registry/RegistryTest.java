package SFC.Registry;

import java.util.BitSet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RegistryTest {
  private static BitSet bits(int... elts) {
    BitSet b = new BitSet();
    for (int e : elts) {
      b.set(e);
    }
    return b;
  }

  @Test
  void testMarkingRegistry() {
    MarkingRegistry registry = new MarkingRegistry();
    Assertions.assertEquals(Registry.MISSING_ELEMENT, registry.get(bits(0)));

    BitSet key = bits(0, 3);
    registry.put(key, 0);
    registry.put(bits(1), 1);
    key.set(5); // registry holds its own copy
    Assertions.assertEquals(0, registry.get(bits(0, 3)));
    Assertions.assertEquals(1, registry.get(bits(1)));
    Assertions.assertEquals(Registry.MISSING_ELEMENT, registry.get(bits(0, 3, 5)));
    Assertions.assertEquals(bits(0, 3), registry.key(0));
    Assertions.assertEquals(2, registry.size());
  }

  @Test
  void testAntichainCoversSupersets() {
    AntichainRegistry registry = new AntichainRegistry();
    registry.put(bits(1, 2), 7);

    Assertions.assertEquals(7, registry.get(bits(1, 2)));
    Assertions.assertEquals(7, registry.get(bits(1, 2, 4)));
    Assertions.assertEquals(Registry.MISSING_ELEMENT, registry.get(bits(1)));
    Assertions.assertEquals(Registry.MISSING_ELEMENT, registry.get(bits(2, 3)));
  }

  @Test
  void testAntichainKeepsMinimalSets() {
    AntichainRegistry registry = new AntichainRegistry();
    registry.put(bits(1, 2, 3), 0);
    registry.put(bits(4), 1);
    Assertions.assertEquals(2, registry.size());

    registry.put(bits(1, 2, 3, 4), 2); // covered, ignored
    Assertions.assertEquals(2, registry.size());
    Assertions.assertEquals(2, registry.getInsertions());

    registry.put(bits(2), 3); // evicts {1, 2, 3}
    Assertions.assertEquals(2, registry.size());
    Assertions.assertEquals(3, registry.get(bits(1, 2, 3)));
    Assertions.assertEquals(1, registry.get(bits(4, 5)));
  }
}
