package SFC.Reachability;

import SFC.Model.ExplorationBudget;

/**
 * Raised when an exploration needs more states or longer firing sequences than its budget allows.
 */
public class ExplorationLimitExceededException extends RuntimeException {
    private final ExplorationBudget budget;

    public ExplorationLimitExceededException(ExplorationBudget budget, String detail) {
        super(detail + " (budget: " + budget + ")");
        this.budget = budget;
    }

    public ExplorationBudget getBudget() {
        return budget;
    }
}
