package SFC.Containment;

import java.io.Serial;
import java.util.concurrent.RecursiveTask;

import SFC.Model.Cancellation;

/**
 * Compares a range of segments, splitting it in halves across the fork/join pool.
 * Outcomes are written into a shared array; each task owns its own index range.
 */
final class SegmentTask extends RecursiveTask<Boolean> {
    private final int lo, hi;
    private final SegmentPairs pairs;
    private final SegmentOutcome[] outcomes;
    private final Cancellation cancellation;

    @Serial
    private static final long serialVersionUID = 12345L;

    SegmentTask(int lo, int hi, SegmentPairs pairs, SegmentOutcome[] outcomes, Cancellation cancellation) {
        this.lo = lo;
        this.hi = hi;
        this.pairs = pairs;
        this.outcomes = outcomes;
        this.cancellation = cancellation;
    }

    /**
     * @return whether any segment of the range failed
     */
    @Override
    protected Boolean compute() {
        if (hi - lo <= 1) {
            return compareOne(lo);
        }
        int mid = lo + (hi - lo) / 2;
        SegmentTask left = new SegmentTask(lo, mid, pairs, outcomes, cancellation);
        SegmentTask right = new SegmentTask(mid, hi, pairs, outcomes, cancellation);
        right.fork();
        boolean r1 = left.compute();
        boolean r2 = right.join();
        return r1 || r2;
    }

    private boolean compareOne(int segment) {
        if (cancellation.isCancelled(segment)) {
            outcomes[segment] = new SegmentOutcome.Cancelled();
            return false;
        }
        SegmentOutcome outcome = pairs.compare(segment, cancellation);
        outcomes[segment] = outcome;
        if (outcome.isFailure()) {
            cancellation.recordFailure(segment);
            return true;
        }
        return false;
    }

    /** Source of the segment comparisons, one per cut point. */
    @FunctionalInterface
    interface SegmentPairs {
        SegmentOutcome compare(int segment, Cancellation cancellation);
    }
}
