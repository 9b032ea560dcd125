package SFC.Containment;

import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import SFC.CutPoints.CutPoint;
import SFC.Model.ExplorationBudget;
import SFC.PetriNet.PetriNet;
import SFC.Reachability.ReachabilityExplorer;

final class SegmentExtractor {

    private SegmentExtractor() {}

    /**
     * Explore segment {@code index}: start at its cut point and stop at every cut-point marking.
     * @throws SFC.Reachability.ExplorationLimitExceededException - if the segment exceeds the budget
     */
    static Segment extract(PetriNet net, List<CutPoint> cutPoints, int index, ExplorationBudget budget) {
        final Set<BitSet> boundary = new HashSet<>();
        for (CutPoint cp : cutPoints) {
            boundary.add(cp.marking().toBitSet());
        }
        final CutPoint start = cutPoints.get(index);
        return new Segment(index, start,
            ReachabilityExplorer.explore(net, start.marking().toBitSet(), boundary::contains, budget));
    }
}
