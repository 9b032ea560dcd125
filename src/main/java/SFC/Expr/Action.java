package SFC.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Sequential assignments executed atomically when a step becomes active.
 */
public record Action(List<Assignment> assignments) {

    public static final Action NONE = new Action(List.of());

    public Action {
        assignments = List.copyOf(assignments);
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    /**
     * Restrict to the assignments whose target is observable, preserving order.
     */
    public Action observable(Set<String> observableVariables) {
        List<Assignment> kept = new ArrayList<>(assignments.size());
        for (Assignment a : assignments) {
            if (observableVariables.contains(a.variable())) {
                kept.add(a);
            }
        }
        return kept.size() == assignments.size() ? this : new Action(kept);
    }

    public void collectVariables(Set<String> out) {
        for (Assignment a : assignments) {
            out.add(a.variable());
            a.value().collectVariables(out);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Assignment a : assignments) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(a);
        }
        return sb.toString();
    }
}
