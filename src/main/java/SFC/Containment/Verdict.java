package SFC.Containment;

import SFC.Model.ExplorationBudget;

/**
 * Outcome of a containment check.
 */
public sealed interface Verdict {

    enum Tag { CONTAINED, NOT_CONTAINED, INCOMPARABLE, EXPLORATION_LIMIT_EXCEEDED }

    Tag tag();

    default boolean isContained() {
        return tag() == Tag.CONTAINED;
    }

    /** Every segment of the original is matched by the candidate. */
    record Contained(int segments) implements Verdict {
        @Override
        public Tag tag() {
            return Tag.CONTAINED;
        }
    }

    record NotContained(Witness witness) implements Verdict {
        @Override
        public Tag tag() {
            return Tag.NOT_CONTAINED;
        }
    }

    /** The nets have no common phase structure, so segments cannot be paired. */
    record Incomparable(String reason) implements Verdict {
        @Override
        public Tag tag() {
            return Tag.INCOMPARABLE;
        }
    }

    /** Undecided: the state space did not fit into the budget. */
    record ExplorationLimitExceeded(ExplorationBudget budget, String detail) implements Verdict {
        @Override
        public Tag tag() {
            return Tag.EXPLORATION_LIMIT_EXCEEDED;
        }
    }
}
