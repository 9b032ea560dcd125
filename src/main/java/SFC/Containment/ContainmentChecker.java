package SFC.Containment;

import java.util.List;
import java.util.concurrent.ForkJoinPool;

import SFC.Chart.SequentialFunctionChart;
import SFC.CutPoints.CutPoint;
import SFC.CutPoints.CutPointFinder;
import SFC.Expr.Action;
import SFC.Expr.GuardImplication;
import SFC.Model.Cancellation;
import SFC.Model.CheckOptions;
import SFC.Model.Direction;
import SFC.Model.ExplorationBudget;
import SFC.Model.ObservationPolicy;
import SFC.PetriNet.PetriNet;
import SFC.PetriNet.PetriNetBuilder;
import SFC.Reachability.ExplorationLimitExceededException;

/**
 * Decides whether a candidate net exhibits every behavior of an original net, phase by phase.
 * <p>
 * Both nets are split at their cut points. Segment {@code i} of the original (from its
 * {@code i}-th cut point to the next cut-point marking or termination) must be matched by
 * segment {@code i} of the candidate, where a firing is matched by a firing into the same step
 * with the same observable assignments and a guard implied by the original's.
 */
public class ContainmentChecker {
    public static boolean DEBUG = false;

    private ContainmentChecker() {}

    public static Verdict check(PetriNet original, PetriNet candidate) {
        return check(original, candidate, CheckOptions.defaults());
    }

    public static Verdict check(SequentialFunctionChart original, SequentialFunctionChart candidate,
                                CheckOptions options) {
        return check(PetriNetBuilder.build(original), PetriNetBuilder.build(candidate), options);
    }

    /**
     * Check containment of the original's behavior in the candidate's.
     * @param original - net of the reference chart
     * @param candidate - net of the modified chart
     * @param options - budget, observation, implication domain, direction and parallelism
     * @return the verdict; exploration limits are reported as a verdict, not thrown
     */
    public static Verdict check(PetriNet original, PetriNet candidate, CheckOptions options) {
        final ExplorationBudget budget = options.budget();
        try {
            final List<CutPoint> originalCuts = CutPointFinder.findCutPoints(original, budget);
            final List<CutPoint> candidateCuts = CutPointFinder.findCutPoints(candidate, budget);
            if (DEBUG) {
                System.out.println("DEBUG: Cut points: original " + originalCuts + ", candidate " + candidateCuts);
            }
            if (originalCuts.size() != candidateCuts.size()) {
                return new Verdict.Incomparable("cut point count mismatch: original has " + originalCuts.size()
                    + ", candidate has " + candidateCuts.size());
            }
            if (originalCuts.isEmpty()) {
                return new Verdict.Contained(0);
            }

            // observation is fixed by the original, also when checking the reverse direction
            final ObservationPolicy.Resolved observation =
                options.observation().resolve(original.variables(), original.stepNames());
            final GuardImplication implication = new GuardImplication(options.implicationDomain());

            final Verdict forward = oneWay(original, originalCuts, candidate, candidateCuts,
                observation, implication, options);
            if (!forward.isContained() || options.direction() == Direction.CONTAINMENT) {
                return forward;
            }
            return oneWay(candidate, candidateCuts, original, originalCuts, observation, implication, options);
        } catch (ExplorationLimitExceededException e) {
            return new Verdict.ExplorationLimitExceeded(budget, e.getMessage());
        }
    }

    private static Verdict oneWay(PetriNet from, List<CutPoint> fromCuts, PetriNet to, List<CutPoint> toCuts,
                                  ObservationPolicy.Resolved observation, GuardImplication implication,
                                  CheckOptions options) {
        final Action fromInit = from.initialAction().observable(observation.variables());
        final Action toInit = to.initialAction().observable(observation.variables());
        if (!fromInit.equals(toInit)) {
            return new Verdict.NotContained(new Witness(0, fromCuts.get(0).name(), List.of(),
                "initial action differs: expected '" + fromInit + "', candidate has '" + toInit + "'"));
        }

        final int n = fromCuts.size();
        final ExplorationBudget budget = options.budget();
        final SegmentTask.SegmentPairs pairs = (segment, segmentCancellation) -> {
            final Segment fromSegment;
            final Segment toSegment;
            try {
                fromSegment = SegmentExtractor.extract(from, fromCuts, segment, budget);
                toSegment = SegmentExtractor.extract(to, toCuts, segment, budget);
            } catch (ExplorationLimitExceededException e) {
                return new SegmentOutcome.LimitExceeded(e.getMessage());
            }
            return new SegmentComparator(fromSegment, toSegment, observation, implication, budget, segmentCancellation)
                .compare();
        };

        final SegmentOutcome[] outcomes = new SegmentOutcome[n];
        final Cancellation cancellation = new Cancellation();
        if (options.parallel() && n > 1) {
            ForkJoinPool.commonPool().invoke(new SegmentTask(0, n, pairs, outcomes, cancellation));
        } else {
            for (int k = 0; k < n; k++) {
                outcomes[k] = pairs.compare(k, cancellation);
                if (outcomes[k].isFailure()) {
                    break;
                }
            }
        }

        int states = 0;
        for (int k = 0; k < n; k++) {
            final SegmentOutcome outcome = outcomes[k];
            if (DEBUG) {
                System.out.println("DEBUG: Segment " + k + " (" + fromCuts.get(k).name() + "): " + outcome);
            }
            if (outcome instanceof SegmentOutcome.Diverged d) {
                return new Verdict.NotContained(d.witness());
            }
            if (outcome instanceof SegmentOutcome.LimitExceeded l) {
                return new Verdict.ExplorationLimitExceeded(budget, l.detail());
            }
            if (outcome instanceof SegmentOutcome.Passed p) {
                states += p.productStates();
            } else {
                // only segments after a failure are cancelled
                throw new IllegalStateException("Segment " + k + " did not complete: " + outcome);
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Contained, " + states + " product states explored");
        }
        return new Verdict.Contained(n);
    }
}
