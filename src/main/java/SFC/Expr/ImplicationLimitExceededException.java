package SFC.Expr;

/**
 * Raised when deciding an implication needs more assignments than the domain's cap allows.
 */
public class ImplicationLimitExceededException extends RuntimeException {
    private final long assignments;

    public ImplicationLimitExceededException(Expr premise, Expr conclusion, long assignments, long cap) {
        super("Implication " + premise + " => " + conclusion + " needs more than " + cap
            + " assignments (at least " + assignments + ")");
        this.assignments = assignments;
    }

    public long getAssignments() {
        return assignments;
    }
}
