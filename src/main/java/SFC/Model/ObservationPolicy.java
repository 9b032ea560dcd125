package SFC.Model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which variables and steps count as externally observable when two charts are compared.
 * Assignments to other variables, and steps outside the observed set that perform no
 * observable assignment, are bookkeeping and are ignored by the comparison.
 * A {@code null} set means "infer from the original chart".
 */
public record ObservationPolicy(Set<String> variables, Set<String> steps) {

    public ObservationPolicy {
        variables = variables == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        steps = steps == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(steps));
    }

    /** Observe exactly the original chart's variables and steps. */
    public static ObservationPolicy inferred() {
        return new ObservationPolicy(null, null);
    }

    /** Observe the given variables; steps are inferred from the original chart. */
    public static ObservationPolicy variables(Set<String> variables) {
        return new ObservationPolicy(variables, null);
    }

    public static ObservationPolicy explicit(Set<String> variables, Set<String> steps) {
        return new ObservationPolicy(variables, steps);
    }

    public Resolved resolve(Set<String> originalVariables, Set<String> originalSteps) {
        return new Resolved(
            variables != null ? variables : Collections.unmodifiableSet(new LinkedHashSet<>(originalVariables)),
            steps != null ? steps : Collections.unmodifiableSet(new LinkedHashSet<>(originalSteps)));
    }

    /** Observation sets fixed for one comparison. */
    public record Resolved(Set<String> variables, Set<String> steps) {}
}
