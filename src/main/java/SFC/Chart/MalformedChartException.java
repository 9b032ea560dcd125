package SFC.Chart;

import java.util.List;

/**
 * A chart description violates the structural invariants. Not recoverable for that input.
 */
public class MalformedChartException extends Exception {

    public enum Reason {
        UNKNOWN_STEP,
        DUPLICATE_STEP,
        MISSING_INITIAL_STEP,
        EMPTY_STEP_NAME,
        BAD_EXPRESSION
    }

    public record Problem(Reason reason, String message) {
        @Override
        public String toString() {
            return reason + ": " + message;
        }
    }

    private final List<Problem> problems;

    public MalformedChartException(List<Problem> problems) {
        super(describe(problems));
        this.problems = List.copyOf(problems);
    }

    public List<Problem> getProblems() {
        return problems;
    }

    public boolean hasReason(Reason reason) {
        return problems.stream().anyMatch(p -> p.reason() == reason);
    }

    private static String describe(List<Problem> problems) {
        if (problems.size() == 1) {
            return "Malformed chart: " + problems.get(0);
        }
        return "Malformed chart (" + problems.size() + " problems): " + problems;
    }
}
