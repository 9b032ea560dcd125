package SFC.PetriNet;

import java.util.BitSet;

/**
 * Token assignment of a 1-safe net: every place holds zero or one token.
 */
public final class Marking {
    private final BitSet marked;

    public Marking(BitSet marked) {
        this.marked = (BitSet) marked.clone();
    }

    public static Marking of(int... places) {
        BitSet b = new BitSet();
        for (int p : places) {
            b.set(p);
        }
        return new Marking(b);
    }

    public int tokens(int place) {
        return marked.get(place) ? 1 : 0;
    }

    public int totalTokens() {
        return marked.cardinality();
    }

    public boolean isEmpty() {
        return marked.isEmpty();
    }

    /** Copy of the marked places. */
    public BitSet toBitSet() {
        return (BitSet) marked.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Marking m && marked.equals(m.marked);
    }

    @Override
    public int hashCode() {
        return marked.hashCode();
    }

    @Override
    public String toString() {
        return marked.toString();
    }
}
