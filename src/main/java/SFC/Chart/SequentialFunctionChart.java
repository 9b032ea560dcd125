package SFC.Chart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import SFC.Chart.MalformedChartException.Problem;
import SFC.Chart.MalformedChartException.Reason;
import SFC.Expr.Action;
import SFC.Expr.Expr;
import SFC.Expr.ExprParser;
import SFC.Expr.ExprSyntaxException;

/**
 * Immutable step/transition chart with a designated initial step.
 * Invariants: step names are unique, every transition connects declared steps,
 * and the initial step is declared.
 */
public final class SequentialFunctionChart {
    private final List<Step> steps;
    private final Map<String, Step> stepsByName;
    private final List<ChartTransition> transitions;
    private final Map<String, List<ChartTransition>> outgoing;
    private final Set<String> variables;
    private final String initialStep;

    private SequentialFunctionChart(List<Step> steps, List<ChartTransition> transitions,
                                    Set<String> variables, String initialStep) {
        this.steps = List.copyOf(steps);
        this.transitions = List.copyOf(transitions);
        this.variables = Collections.unmodifiableSet(variables);
        this.initialStep = initialStep;

        Map<String, Step> byName = new LinkedHashMap<>();
        Map<String, List<ChartTransition>> out = new HashMap<>();
        for (Step s : this.steps) {
            byName.put(s.name(), s);
            out.put(s.name(), new ArrayList<>());
        }
        for (ChartTransition t : this.transitions) {
            out.get(t.source()).add(t);
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        this.stepsByName = Collections.unmodifiableMap(byName);
        this.outgoing = Collections.unmodifiableMap(out);
    }

    /**
     * Validate a description and build the chart. All violations are collected before failing.
     * @param description - structural description from any chart source
     * @return the chart
     * @throws MalformedChartException - listing every problem found
     */
    public static SequentialFunctionChart of(ChartDescription description) throws MalformedChartException {
        List<Problem> problems = new ArrayList<>();

        List<Step> steps = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for (ChartDescription.StepSpec spec : description.steps()) {
            if (spec.name() == null || spec.name().isBlank()) {
                problems.add(new Problem(Reason.EMPTY_STEP_NAME,
                    "Step #%d has no name".formatted(steps.size())));
                continue;
            }
            if (!names.add(spec.name())) {
                problems.add(new Problem(Reason.DUPLICATE_STEP,
                    "Step '%s' is declared more than once".formatted(spec.name())));
                continue;
            }
            Action action = Action.NONE;
            try {
                action = ExprParser.parseAction(spec.function());
            } catch (ExprSyntaxException e) {
                problems.add(new Problem(Reason.BAD_EXPRESSION,
                    "Step '%s': %s".formatted(spec.name(), e.getMessage())));
            }
            steps.add(new Step(steps.size(), spec.name(), action));
        }

        String initial = description.initialStep();
        if (initial == null || initial.isBlank()) {
            problems.add(new Problem(Reason.MISSING_INITIAL_STEP, "No initial step given"));
        } else if (!names.contains(initial)) {
            problems.add(new Problem(Reason.MISSING_INITIAL_STEP,
                "Initial step '%s' not found in steps".formatted(initial)));
        }

        List<ChartTransition> transitions = new ArrayList<>();
        int index = -1;
        for (ChartDescription.TransitionSpec spec : description.transitions()) {
            index++;
            boolean known = true;
            if (!names.contains(spec.src())) {
                problems.add(new Problem(Reason.UNKNOWN_STEP,
                    "Transition #%d: source step '%s' not found in steps".formatted(index, spec.src())));
                known = false;
            }
            if (!names.contains(spec.tgt())) {
                problems.add(new Problem(Reason.UNKNOWN_STEP,
                    "Transition #%d: target step '%s' not found in steps".formatted(index, spec.tgt())));
                known = false;
            }
            Expr guard = Expr.TRUE;
            try {
                guard = ExprParser.parseGuard(spec.guard());
            } catch (ExprSyntaxException e) {
                problems.add(new Problem(Reason.BAD_EXPRESSION,
                    "Transition %s -> %s: %s".formatted(spec.src(), spec.tgt(), e.getMessage())));
            }
            if (known) {
                transitions.add(new ChartTransition(index, spec.src(), spec.tgt(), guard));
            }
        }

        if (!problems.isEmpty()) {
            throw new MalformedChartException(problems);
        }

        // declared variables first, then the closure of referenced names
        Set<String> variables = new LinkedHashSet<>(description.variables());
        for (Step s : steps) {
            s.action().collectVariables(variables);
        }
        for (ChartTransition t : transitions) {
            t.guard().collectVariables(variables);
        }
        return new SequentialFunctionChart(steps, transitions, variables, initial);
    }

    /** Step names in declaration order. */
    public List<String> stepNames() {
        return List.copyOf(stepsByName.keySet());
    }

    public List<Step> steps() {
        return steps;
    }

    public Step step(String name) {
        Step s = stepsByName.get(name);
        if (s == null) {
            throw new IllegalArgumentException("Unknown step: " + name);
        }
        return s;
    }

    public boolean hasStep(String name) {
        return stepsByName.containsKey(name);
    }

    public Action action(String stepName) {
        return step(stepName).action();
    }

    /** Outgoing transitions of a step, in declaration order. */
    public List<ChartTransition> outgoing(String stepName) {
        List<ChartTransition> out = outgoing.get(stepName);
        if (out == null) {
            throw new IllegalArgumentException("Unknown step: " + stepName);
        }
        return out;
    }

    public List<ChartTransition> transitions() {
        return transitions;
    }

    public Set<String> variables() {
        return variables;
    }

    public String initialStep() {
        return initialStep;
    }

    @Override
    public String toString() {
        return "SFC(" + steps.size() + " steps, " + transitions.size() + " transitions, initial=" + initialStep + ")";
    }
}
