package SFC.Reachability;

import java.util.BitSet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import SFC.ChartFixtures;
import SFC.Model.ExplorationBudget;
import SFC.PetriNet.Marking;
import SFC.PetriNet.PetriNet;
import SFC.PetriNet.PetriNetBuilder;
import SFC.Registry.Registry;

public class ReachabilityExplorerTest {

  @Test
  void testFactorialGraph() {
    PetriNet net = ChartFixtures.net("factorial");
    ReachabilityGraph graph = ReachabilityExplorer.explore(net, ExplorationBudget.defaults());

    Assertions.assertEquals(5, graph.size());
    Assertions.assertEquals(0, graph.start());
    int end = graph.id(Marking.of(4).toBitSet());
    Assertions.assertTrue(graph.isTerminal(end));
    Assertions.assertFalse(graph.isTerminal(graph.start()));
    Assertions.assertEquals(2, graph.depth(end));

    int check = graph.id(Marking.of(1).toBitSet());
    ReachabilityGraph.Edges edges = graph.edges(check);
    Assertions.assertEquals(2, edges.size());
    Assertions.assertEquals(1, edges.transitions().getInt(0));
    Assertions.assertEquals(graph.id(Marking.of(2).toBitSet()), edges.targets().getInt(0));
    Assertions.assertEquals(end, edges.targets().getInt(1));

    // the automaton view carries the same edges
    Assertions.assertEquals(1, graph.lts().getTransitions(check, 1).size());
    Assertions.assertEquals(Registry.MISSING_ELEMENT, graph.id(new BitSet()));
  }

  @Test
  void testBoundaryIsNotExpanded() {
    PetriNet net = ChartFixtures.net("factorial");
    BitSet check = Marking.of(1).toBitSet();
    ReachabilityGraph graph = ReachabilityExplorer.explore(net, net.initialMarking().toBitSet(),
        check::equals, ExplorationBudget.defaults());

    Assertions.assertEquals(2, graph.size());
    int id = graph.id(check);
    Assertions.assertTrue(graph.isBoundary(id));
    Assertions.assertFalse(graph.isTerminal(id));
    Assertions.assertEquals(0, graph.edges(id).size());
  }

  @Test
  void testStartIsExpandedEvenOnBoundary() {
    PetriNet net = ChartFixtures.net("factorial");
    BitSet check = Marking.of(1).toBitSet();
    ReachabilityGraph graph = ReachabilityExplorer.explore(net, check, check::equals, ExplorationBudget.defaults());

    // Check, Multiply, Increment, End
    Assertions.assertEquals(4, graph.size());
    Assertions.assertFalse(graph.isBoundary(graph.start()));
  }

  @Test
  void testSingleStep() {
    PetriNet net = PetriNetBuilder.build(ChartFixtures.singleStep());
    ReachabilityGraph graph = ReachabilityExplorer.explore(net, ExplorationBudget.defaults());

    Assertions.assertEquals(1, graph.size());
    Assertions.assertTrue(graph.isTerminal(0));
  }

  @Test
  void testBudget() {
    PetriNet net = ChartFixtures.net("factorial");

    ExplorationLimitExceededException e = Assertions.assertThrows(ExplorationLimitExceededException.class,
        () -> ReachabilityExplorer.explore(net, new ExplorationBudget(3, 100)));
    Assertions.assertEquals(3, e.getBudget().maxMarkings());

    Assertions.assertThrows(ExplorationLimitExceededException.class,
        () -> ReachabilityExplorer.explore(net, new ExplorationBudget(100, 1)));
    Assertions.assertEquals(5, ReachabilityExplorer.explore(net, new ExplorationBudget(5, 3)).size());
  }
}
