package SFC.Chart;

import java.util.ArrayList;
import java.util.List;

/**
 * Unvalidated structural description of a chart, as supplied by a chart source
 * (a file, a test, or a generated replacement).
 */
public record ChartDescription(
    List<StepSpec> steps,
    List<TransitionSpec> transitions,
    List<String> variables,
    String initialStep // nullable
) {
    public ChartDescription {
        steps = List.copyOf(steps);
        transitions = List.copyOf(transitions);
        variables = List.copyOf(variables);
    }

    /** A step name and its action text, e.g. {@code "i := 1; fact := 1"}. */
    public record StepSpec(String name, String function) {}

    /** Source step, target step and guard text. */
    public record TransitionSpec(String src, String tgt, String guard) {}

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<StepSpec> steps = new ArrayList<>();
        private final List<TransitionSpec> transitions = new ArrayList<>();
        private final List<String> variables = new ArrayList<>();
        private String initialStep;

        private Builder() {}

        public Builder step(String name, String function) {
            steps.add(new StepSpec(name, function));
            return this;
        }

        public Builder transition(String src, String tgt, String guard) {
            transitions.add(new TransitionSpec(src, tgt, guard));
            return this;
        }

        public Builder variables(String... names) {
            variables.addAll(List.of(names));
            return this;
        }

        public Builder initialStep(String name) {
            this.initialStep = name;
            return this;
        }

        public ChartDescription build() {
            return new ChartDescription(steps, transitions, variables, initialStep);
        }
    }
}
