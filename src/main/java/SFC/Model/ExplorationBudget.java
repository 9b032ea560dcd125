package SFC.Model;

/**
 * Caller-supplied bound on state-space exploration. Applies to every reachability graph
 * built for cut points and segments, and to the product states of a segment comparison.
 * @param maxMarkings - maximum number of distinct states explored
 * @param maxSequenceLength - maximum firing-sequence length from the exploration start
 */
public record ExplorationBudget(int maxMarkings, int maxSequenceLength) {
    public static final int DEFAULT_MAX_MARKINGS = 5000;
    public static final int DEFAULT_MAX_SEQUENCE_LENGTH = 1000;

    public ExplorationBudget {
        if (maxMarkings < 1 || maxSequenceLength < 0) {
            throw new IllegalArgumentException(
                "Invalid exploration budget: " + maxMarkings + " markings, " + maxSequenceLength + " firings");
        }
    }

    public static ExplorationBudget defaults() {
        return new ExplorationBudget(DEFAULT_MAX_MARKINGS, DEFAULT_MAX_SEQUENCE_LENGTH);
    }

    public static ExplorationBudget unbounded() {
        return new ExplorationBudget(Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    public boolean isAboveMarkings(int markings) {
        return markings > maxMarkings;
    }

    public boolean isAboveLength(int length) {
        return length > maxSequenceLength;
    }

    @Override
    public String toString() {
        return maxMarkings + " markings / " + maxSequenceLength + " firings";
    }
}
