package SFC.Reachability;

import java.util.BitSet;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import SFC.PetriNet.Marking;
import SFC.PetriNet.PetriNet;
import SFC.Registry.MarkingRegistry;

/**
 * Explored part of a net's marking graph.
 * State {@code i} of the underlying automaton is the marking registered as {@code i};
 * its input symbols are net transition indices and its accepting states are the terminal markings.
 * Boundary markings are registered but have no outgoing edges.
 */
public final class ReachabilityGraph {
    private final PetriNet net;
    private final CompactNFA<Integer> lts;
    private final MarkingRegistry markings;
    private final int start;
    private final BitSet boundary;
    private final IntArrayList depths;

    ReachabilityGraph(PetriNet net, CompactNFA<Integer> lts, MarkingRegistry markings, int start,
                      BitSet boundary, IntArrayList depths) {
        this.net = net;
        this.lts = lts;
        this.markings = markings;
        this.start = start;
        this.boundary = boundary;
        this.depths = depths;
    }

    public PetriNet net() {
        return net;
    }

    /** Labelled transition system view; do not modify. */
    public CompactNFA<Integer> lts() {
        return lts;
    }

    public int size() {
        return lts.size();
    }

    public int start() {
        return start;
    }

    public BitSet marking(int id) {
        return markings.key(id);
    }

    public Marking markingOf(int id) {
        return new Marking(markings.key(id));
    }

    /** Identifier of a marking, or {@link MarkingRegistry#MISSING_ELEMENT}. */
    public int id(BitSet marking) {
        return markings.get(marking);
    }

    /** Length of the shortest firing sequence from the start to {@code id}. */
    public int depth(int id) {
        return depths.getInt(id);
    }

    /** Expanded marking without enabled transitions. */
    public boolean isTerminal(int id) {
        return lts.isAccepting(id);
    }

    /** Registered but not expanded. */
    public boolean isBoundary(int id) {
        return boundary.get(id);
    }

    /**
     * Outgoing edges of a marking as parallel lists of net transitions and target ids,
     * in transition index order.
     */
    public Edges edges(int id) {
        IntList transitions = new IntArrayList();
        IntList targets = new IntArrayList();
        if (!isBoundary(id)) {
            for (int t : net.enabled(markings.key(id))) {
                for (int succ : lts.getTransitions(id, t)) {
                    transitions.add(t);
                    targets.add(succ);
                }
            }
        }
        return new Edges(transitions, targets);
    }

    public record Edges(IntList transitions, IntList targets) {
        public int size() {
            return transitions.size();
        }
    }

    @Override
    public String toString() {
        return "ReachabilityGraph(" + size() + " markings from " + net.describe(marking(start)) + ")";
    }
}
