package SFC.Reachability;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.function.Predicate;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import SFC.Model.ExplorationBudget;
import SFC.Model.ExplorationRecord;
import SFC.PetriNet.PetriNet;
import SFC.Registry.MarkingRegistry;
import SFC.Registry.Registry;

/**
 * Bounded breadth-first construction of reachability graphs.
 */
public final class ReachabilityExplorer {

    private ReachabilityExplorer() {}

    public static ReachabilityGraph explore(PetriNet net, ExplorationBudget budget) {
        return explore(net, net.initialMarking().toBitSet(), m -> false, budget);
    }

    /**
     * Explore the markings reachable from {@code start}.
     * @param net - net to fire
     * @param start - first marking; always expanded, even if it satisfies {@code boundary}
     * @param boundary - markings that are registered but not expanded
     * @param budget - exploration limits
     * @return the explored graph
     * @throws ExplorationLimitExceededException - if the budget is exhausted
     * @throws IllegalStateException - if firing violates 1-safety
     */
    public static ReachabilityGraph explore(PetriNet net, BitSet start, Predicate<BitSet> boundary,
                                            ExplorationBudget budget) {
        final Alphabet<Integer> transitions = Alphabets.integers(0, Math.max(0, net.transitions().size() - 1));
        final CompactNFA<Integer> lts = new CompactNFA<>(transitions);
        final MarkingRegistry registry = new MarkingRegistry();
        final BitSet boundaryIds = new BitSet();
        final IntArrayList depths = new IntArrayList();

        final int init = lts.addInitialState(false);
        registry.put(start, init);
        depths.add(0);

        final Deque<ExplorationRecord<BitSet>> queue = new ArrayDeque<>();
        queue.add(new ExplorationRecord<>(start, init, 0));
        while (!queue.isEmpty()) {
            final ExplorationRecord<BitSet> curr = queue.poll();
            final BitSet marking = curr.state();
            final int id = curr.id();
            boolean dead = true;
            for (int t : net.enabled(marking)) {
                dead = false;
                final BitSet succ = net.fire(marking, t);
                int succId = registry.get(succ);
                if (succId == Registry.MISSING_ELEMENT) {
                    if (budget.isAboveLength(curr.depth() + 1)) {
                        throw new ExplorationLimitExceededException(budget,
                            "Firing sequence from " + net.describe(start) + " longer than " + budget.maxSequenceLength());
                    }
                    if (budget.isAboveMarkings(registry.size() + 1)) {
                        throw new ExplorationLimitExceededException(budget,
                            "More than " + budget.maxMarkings() + " markings reachable from " + net.describe(start));
                    }
                    succId = lts.addState(false);
                    registry.put(succ, succId);
                    depths.add(curr.depth() + 1);
                    if (boundary.test(succ)) {
                        boundaryIds.set(succId);
                    } else {
                        queue.add(new ExplorationRecord<>(succ, succId, curr.depth() + 1));
                    }
                }
                lts.addTransition(id, t, succId);
            }
            if (dead) {
                lts.setAccepting(id, true);
            }
        }
        return new ReachabilityGraph(net, lts, registry, init, boundaryIds, depths);
    }
}
