package SFC.Containment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import SFC.Expr.Action;
import SFC.Expr.Expr;
import SFC.Expr.GuardImplication;
import SFC.Expr.ImplicationLimitExceededException;
import SFC.Model.Cancellation;
import SFC.Model.ExplorationBudget;
import SFC.Model.ObservationPolicy;
import SFC.PetriNet.NetTransition;
import SFC.PetriNet.PetriNet;
import SFC.Reachability.ExplorationLimitExceededException;
import SFC.Reachability.ReachabilityGraph;
import SFC.Registry.AntichainRegistry;
import SFC.Registry.Registry;

/**
 * Trace inclusion of one segment in another, up to guard implication.
 * <p>
 * On-the-fly subset construction: every product state pairs one guarded marking of the
 * original segment with the set of candidate guarded markings reachable by the same observable
 * firings. Unobservable firings extend the guard context instead of producing a label.
 * Product states whose candidate set includes an already visited set for the same original
 * state are skipped.
 */
final class SegmentComparator {

    /** A marking together with the conjunction of the unobservable guards fired since the last label. */
    record GuardedMarking(int marking, Expr context) {}

    private record Node(GuardedMarking original, BitSet candidates, int parent, String firing, int depth) {}

    private final Segment original;
    private final Segment candidate;
    private final ObservationPolicy.Resolved observation;
    private final GuardImplication implication;
    private final ExplorationBudget budget;
    private final Cancellation cancellation;

    // candidate guarded markings, interned
    private final Object2IntMap<GuardedMarking> candidateIds = new Object2IntOpenHashMap<>();
    private final List<GuardedMarking> candidateStates = new ArrayList<>();

    SegmentComparator(Segment original, Segment candidate, ObservationPolicy.Resolved observation,
                      GuardImplication implication, ExplorationBudget budget, Cancellation cancellation) {
        this.original = original;
        this.candidate = candidate;
        this.observation = observation;
        this.implication = implication;
        this.budget = budget;
        this.cancellation = cancellation;
        this.candidateIds.defaultReturnValue(Registry.MISSING_ELEMENT);
    }

    SegmentOutcome compare() {
        try {
            return explore();
        } catch (ExplorationLimitExceededException e) {
            return new SegmentOutcome.LimitExceeded(e.getMessage());
        } catch (ImplicationLimitExceededException e) {
            return new SegmentOutcome.LimitExceeded(
                "Segment " + original.index() + " (" + original.cutPoint().name() + "): " + e.getMessage());
        }
    }

    private SegmentOutcome explore() {
        final ReachabilityGraph orig = original.graph();
        final ReachabilityGraph cand = candidate.graph();
        final PetriNet origNet = orig.net();

        final List<Node> nodes = new ArrayList<>();
        final Map<GuardedMarking, AntichainRegistry> visited = new HashMap<>();
        final Deque<Integer> queue = new ArrayDeque<>();

        final BitSet seed = new BitSet();
        seed.set(intern(new GuardedMarking(cand.start(), Expr.TRUE)));
        push(new Node(new GuardedMarking(orig.start(), Expr.TRUE), closure(seed), -1, null, 0),
            nodes, visited, queue);

        while (!queue.isEmpty()) {
            if (cancellation.isCancelled(original.index())) {
                return new SegmentOutcome.Cancelled();
            }
            final int nodeId = queue.poll();
            final Node node = nodes.get(nodeId);
            final GuardedMarking o = node.original();
            final ReachabilityGraph.Edges edges = orig.edges(o.marking());
            for (int k = 0; k < edges.size(); k++) {
                final NetTransition a = origNet.transition(edges.transitions().getInt(k));
                final int target = edges.targets().getInt(k);
                if (isSilent(a)) {
                    push(new Node(new GuardedMarking(target, Expr.and(o.context(), a.guard())), node.candidates(),
                        nodeId, a.describe(), node.depth() + 1), nodes, visited, queue);
                    continue;
                }
                final Expr premise = Expr.and(o.context(), a.guard());
                final BitSet matched = match(a, premise, node.candidates());
                if (matched.isEmpty()) {
                    return new SegmentOutcome.Diverged(witness(nodes, nodeId, a, node.candidates()));
                }
                push(new Node(new GuardedMarking(target, Expr.TRUE), closure(matched), nodeId, a.describe(),
                    node.depth() + 1), nodes, visited, queue);
            }
        }
        return new SegmentOutcome.Passed(nodes.size());
    }

    private void push(Node node, List<Node> nodes, Map<GuardedMarking, AntichainRegistry> visited,
                      Deque<Integer> queue) {
        final AntichainRegistry seen = visited.computeIfAbsent(node.original(), k -> new AntichainRegistry());
        if (seen.get(node.candidates()) != Registry.MISSING_ELEMENT) {
            return;
        }
        if (budget.isAboveMarkings(nodes.size() + 1)) {
            throw new ExplorationLimitExceededException(budget,
                "Segment " + original.index() + " (" + original.cutPoint().name() + "): more than "
                    + budget.maxMarkings() + " product states");
        }
        if (budget.isAboveLength(node.depth())) {
            throw new ExplorationLimitExceededException(budget,
                "Segment " + original.index() + " (" + original.cutPoint().name() + "): firing sequence longer than "
                    + budget.maxSequenceLength());
        }
        final int id = nodes.size();
        nodes.add(node);
        seen.put(node.candidates(), id);
        queue.add(id);
    }

    /**
     * Candidate states reached by an observable firing matching {@code a}.
     */
    private BitSet match(NetTransition a, Expr premise, BitSet candidates) {
        final ReachabilityGraph cand = candidate.graph();
        final BitSet out = new BitSet();
        final Action expected = a.action().observable(observation.variables());
        for (int c = candidates.nextSetBit(0); c >= 0; c = candidates.nextSetBit(c + 1)) {
            final GuardedMarking gm = candidateStates.get(c);
            final ReachabilityGraph.Edges edges = cand.edges(gm.marking());
            for (int k = 0; k < edges.size(); k++) {
                final NetTransition b = cand.net().transition(edges.transitions().getInt(k));
                if (isSilent(b)
                    || !a.targetStep().equals(b.targetStep())
                    || !expected.equals(b.action().observable(observation.variables()))) {
                    continue;
                }
                if (implication.implies(premise, Expr.and(gm.context(), b.guard()))) {
                    out.set(intern(new GuardedMarking(edges.targets().getInt(k), Expr.TRUE)));
                }
            }
        }
        return out;
    }

    /**
     * Close a set of candidate states under unobservable firings.
     */
    private BitSet closure(BitSet seed) {
        final ReachabilityGraph cand = candidate.graph();
        final BitSet out = (BitSet) seed.clone();
        final Deque<Integer> work = new ArrayDeque<>();
        for (int c = seed.nextSetBit(0); c >= 0; c = seed.nextSetBit(c + 1)) {
            work.add(c);
        }
        while (!work.isEmpty()) {
            final GuardedMarking gm = candidateStates.get(work.poll());
            final ReachabilityGraph.Edges edges = cand.edges(gm.marking());
            for (int k = 0; k < edges.size(); k++) {
                final NetTransition b = cand.net().transition(edges.transitions().getInt(k));
                if (!isSilent(b)) {
                    continue;
                }
                final int succ = intern(new GuardedMarking(edges.targets().getInt(k), Expr.and(gm.context(), b.guard())));
                if (!out.get(succ)) {
                    out.set(succ);
                    work.add(succ);
                }
            }
        }
        return out;
    }

    private int intern(GuardedMarking gm) {
        int id = candidateIds.getInt(gm);
        if (id == Registry.MISSING_ELEMENT) {
            if (budget.isAboveMarkings(candidateStates.size() + 1)) {
                throw new ExplorationLimitExceededException(budget,
                    "Segment " + original.index() + " (" + original.cutPoint().name() + "): more than "
                        + budget.maxMarkings() + " guarded candidate markings");
            }
            id = candidateStates.size();
            candidateStates.add(gm);
            candidateIds.put(gm, id);
        }
        return id;
    }

    /**
     * Bookkeeping firings, and firings into unobserved steps that assign no observed variable.
     */
    boolean isSilent(NetTransition t) {
        if (t.isBookkeeping()) {
            return true;
        }
        return !observation.steps().contains(t.targetStep())
            && t.action().observable(observation.variables()).isEmpty();
    }

    private Witness witness(List<Node> nodes, int nodeId, NetTransition diverging, BitSet candidates) {
        final List<String> trace = new ArrayList<>();
        trace.add(diverging.describe());
        for (int n = nodeId; nodes.get(n).parent() >= 0; n = nodes.get(n).parent()) {
            trace.add(nodes.get(n).firing());
        }
        Collections.reverse(trace);

        final Set<String> offered = new LinkedHashSet<>();
        final ReachabilityGraph cand = candidate.graph();
        for (int c = candidates.nextSetBit(0); c >= 0; c = candidates.nextSetBit(c + 1)) {
            final ReachabilityGraph.Edges edges = cand.edges(candidateStates.get(c).marking());
            for (int k = 0; k < edges.size(); k++) {
                final NetTransition b = cand.net().transition(edges.transitions().getInt(k));
                if (!isSilent(b)) {
                    offered.add(b.describe());
                }
            }
        }
        final String reason = "no candidate firing matches " + diverging.describe()
            + (offered.isEmpty() ? "; candidate offers nothing" : "; candidate offers " + offered);
        return new Witness(original.index(), original.cutPoint().name(), trace, reason);
    }
}
