package SFC.Containment;

/**
 * Result of comparing one pair of segments.
 */
sealed interface SegmentOutcome {

    default boolean isFailure() {
        return this instanceof Diverged || this instanceof LimitExceeded;
    }

    record Passed(int productStates) implements SegmentOutcome {}

    record Diverged(Witness witness) implements SegmentOutcome {}

    record LimitExceeded(String detail) implements SegmentOutcome {}

    /** Stopped because an earlier segment already failed. */
    record Cancelled() implements SegmentOutcome {}
}
