package SFC.Model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cooperative cancellation shared by the segment comparisons of one check.
 * Once a segment fails, every segment with a higher index may stop; lower segments keep
 * running so the reported failure is always the earliest one.
 */
public class Cancellation {
    private static final int NO_FAILURE = Integer.MAX_VALUE;

    private final AtomicInteger firstFailure = new AtomicInteger(NO_FAILURE);
    private volatile boolean interrupted;

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public void recordFailure(int segment) {
        firstFailure.accumulateAndGet(segment, Math::min);
    }

    public boolean hasFailure() {
        return firstFailure.get() != NO_FAILURE;
    }

    public boolean isCancelled(int segment) {
        return isInterrupted() || firstFailure.get() < segment;
    }
}
