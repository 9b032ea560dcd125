package SFC.CutPoints;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import SFC.Model.ExplorationBudget;
import SFC.PetriNet.Marking;
import SFC.PetriNet.PetriNet;
import SFC.PetriNet.Place;
import SFC.Reachability.ReachabilityExplorer;
import SFC.Reachability.ReachabilityGraph;

/**
 * Finds the markings that dominate every complete run of a net.
 * <p>
 * The reachability graph is unrolled once: edges closing a cycle (back edges) are removed and
 * their sources, like the terminal markings, lead to a virtual exit. The dominators of that exit
 * are the phase boundaries, ordered by dominance.
 */
public class CutPointFinder {
    public static boolean DEBUG = false;

    private CutPointFinder() {}

    public static List<CutPoint> findCutPoints(PetriNet net) {
        return findCutPoints(net, ExplorationBudget.defaults());
    }

    /**
     * Compute the cut points of a net.
     * @param net - translated chart
     * @param budget - limit on the reachability graph
     * @return cut points in dominance order; the first one holds the initial marking. Empty for an empty net.
     * @throws SFC.Reachability.ExplorationLimitExceededException - if the reachability graph exceeds the budget
     */
    public static List<CutPoint> findCutPoints(PetriNet net, ExplorationBudget budget) {
        if (net.isEmpty()) {
            return Collections.emptyList();
        }
        final ReachabilityGraph graph = ReachabilityExplorer.explore(net, budget);
        final Unrolled unrolled = unroll(graph);
        final int[] dominating = dominatorsOfExit(unrolled, graph.start());
        final List<CutPoint> cutPoints = collapse(graph, unrolled, dominating);
        if (DEBUG) {
            System.out.println("DEBUG: " + graph.size() + " markings, " + unrolled.loopHeads.cardinality()
                + " loop heads, cut points " + cutPoints);
        }
        return cutPoints;
    }

    /*
    The acyclic graph: every node except the virtual exit is a marking id.
     */
    private static final class Unrolled {
        final int exit;
        final IntList[] succs;
        final IntList[] preds;
        final BitSet loopHeads = new BitSet();
        // degrees in the full reachability graph
        final int[] outDegree;
        final int[] inDegree;

        Unrolled(int markings) {
            this.exit = markings;
            this.succs = new IntList[markings + 1];
            this.preds = new IntList[markings + 1];
            for (int k = 0; k <= markings; k++) {
                succs[k] = new IntArrayList();
                preds[k] = new IntArrayList();
            }
            this.outDegree = new int[markings];
            this.inDegree = new int[markings];
        }

        void addEdge(int from, int to) {
            succs[from].add(to);
            preds[to].add(from);
        }
    }

    private static Unrolled unroll(ReachabilityGraph graph) {
        final int n = graph.size();
        final Unrolled out = new Unrolled(n);
        final ReachabilityGraph.Edges[] edges = new ReachabilityGraph.Edges[n];
        for (int u = 0; u < n; u++) {
            edges[u] = graph.edges(u);
            out.outDegree[u] = edges[u].size();
            for (int v : edges[u].targets()) {
                out.inDegree[v]++;
            }
        }

        // iterative DFS; a back edge leads to a marking still on the stack
        final BitSet onStack = new BitSet(n);
        final BitSet visited = new BitSet(n);
        final BitSet backSources = new BitSet(n);
        final Deque<int[]> stack = new ArrayDeque<>(); // {node, next edge}
        stack.push(new int[]{graph.start(), 0});
        visited.set(graph.start());
        onStack.set(graph.start());
        while (!stack.isEmpty()) {
            final int[] frame = stack.peek();
            final int u = frame[0];
            if (frame[1] == edges[u].size()) {
                stack.pop();
                onStack.clear(u);
                continue;
            }
            final int v = edges[u].targets().getInt(frame[1]++);
            if (onStack.get(v)) {
                backSources.set(u);
                out.loopHeads.set(v);
                continue;
            }
            out.addEdge(u, v);
            if (!visited.get(v)) {
                visited.set(v);
                onStack.set(v);
                stack.push(new int[]{v, 0});
            }
        }

        for (int u = 0; u < n; u++) {
            if (graph.isTerminal(u) || backSources.get(u)) {
                out.addEdge(u, out.exit);
            }
        }
        return out;
    }

    /*
    Dominators of the virtual exit, from the start marking down to the exit's immediate dominator.
     */
    private static int[] dominatorsOfExit(Unrolled unrolled, int start) {
        final int[] rpo = reversePostorder(unrolled, start);
        final int[] idom = Dominators.immediateDominators(unrolled.preds, rpo);
        if (idom[unrolled.exit] == Dominators.UNDEFINED) {
            throw new IllegalStateException("Exit not reachable from the initial marking; dominators undefined");
        }
        final IntArrayList chain = new IntArrayList();
        for (int d = idom[unrolled.exit]; ; d = idom[d]) {
            chain.add(d);
            if (d == start) {
                break;
            }
        }
        final int[] out = new int[chain.size()];
        for (int k = 0; k < out.length; k++) {
            out[k] = chain.getInt(out.length - 1 - k);
        }
        return out;
    }

    private static int[] reversePostorder(Unrolled unrolled, int start) {
        final IntArrayList post = new IntArrayList();
        final BitSet visited = new BitSet();
        final Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{start, 0});
        visited.set(start);
        while (!stack.isEmpty()) {
            final int[] frame = stack.peek();
            final IntList succ = unrolled.succs[frame[0]];
            if (frame[1] == succ.size()) {
                stack.pop();
                post.add(frame[0]);
                continue;
            }
            final int v = succ.getInt(frame[1]++);
            if (!visited.get(v)) {
                visited.set(v);
                stack.push(new int[]{v, 0});
            }
        }
        final int[] rpo = new int[post.size()];
        for (int k = 0; k < rpo.length; k++) {
            rpo[k] = post.getInt(rpo.length - 1 - k);
        }
        return rpo;
    }

    /*
    Consecutive dominators joined by a single unbranched edge cover the same runs;
    each such run contributes one cut point.
     */
    private static List<CutPoint> collapse(ReachabilityGraph graph, Unrolled unrolled, int[] dominating) {
        final PetriNet net = graph.net();
        final List<CutPoint> out = new ArrayList<>();
        int runStart = 0;
        for (int k = 1; k <= dominating.length; k++) {
            final boolean joined = k < dominating.length
                && unrolled.outDegree[dominating[k - 1]] == 1
                && unrolled.inDegree[dominating[k]] == 1;
            if (!joined) {
                out.add(representative(graph, unrolled, net, dominating, runStart, k, out.size()));
                runStart = k;
            }
        }
        return out;
    }

    private static CutPoint representative(ReachabilityGraph graph, Unrolled unrolled, PetriNet net,
                                           int[] dominating, int from, int to, int order) {
        int chosenMarking = dominating[from];
        Place chosen = null;
        for (int k = from; k < to && chosen == null; k++) {
            final BitSet m = graph.marking(dominating[k]);
            for (int p = m.nextSetBit(0); p >= 0; p = m.nextSetBit(p + 1)) {
                if (net.place(p).isStep()) {
                    chosen = net.place(p);
                    chosenMarking = dominating[k];
                    break;
                }
            }
        }
        if (chosen == null) {
            final BitSet m = graph.marking(chosenMarking);
            chosen = net.place(m.nextSetBit(0));
        }
        final Marking marking = graph.markingOf(chosenMarking);
        return new CutPoint(order, chosen, marking, unrolled.loopHeads.get(chosenMarking));
    }
}
