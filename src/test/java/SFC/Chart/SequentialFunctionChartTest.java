package SFC.Chart;

import java.util.List;

import org.junit.jupiter.api.Test;

import SFC.ChartFixtures;
import SFC.Chart.MalformedChartException.Reason;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SequentialFunctionChartTest {

    @Test
    void exposesStepsInDeclarationOrder() {
        SequentialFunctionChart sfc = ChartFixtures.chart("factorial");

        assertThat(sfc.stepNames()).containsExactly("Start", "Check", "Multiply", "Increment", "End");
        assertThat(sfc.initialStep()).isEqualTo("Start");
        assertThat(sfc.action("Start").toString()).isEqualTo("i := 1; fact := 1");
        assertThat(sfc.action("Check").isEmpty()).isTrue();
        assertThat(sfc.outgoing("Check")).extracting(ChartTransition::target).containsExactly("Multiply", "End");
        assertThat(sfc.transitions()).hasSize(5);
    }

    @Test
    void variablesAreDeclaredNamesThenReferencedOnes() {
        SequentialFunctionChart sfc = ChartFixtures.of(ChartDescription.builder()
            .step("A", "x := y + 1")
            .step("B", "")
            .transition("A", "B", "z > 0")
            .variables("w")
            .initialStep("A")
            .build());

        assertThat(sfc.variables()).containsExactly("w", "x", "y", "z");
    }

    @Test
    void collectsEveryProblem() {
        ChartDescription description = ChartDescription.builder()
            .step("A", "")
            .step("A", "")
            .step("", "")
            .step("B", "x :=")
            .transition("A", "Missing", "True")
            .transition("A", "B", "x >")
            .initialStep("Nowhere")
            .build();

        MalformedChartException e = catchThrowableOfType(
            () -> SequentialFunctionChart.of(description), MalformedChartException.class);

        assertThat(e).isNotNull();
        assertThat(e.getProblems()).extracting(MalformedChartException.Problem::reason).containsExactlyInAnyOrder(
            Reason.DUPLICATE_STEP, Reason.EMPTY_STEP_NAME, Reason.BAD_EXPRESSION,
            Reason.MISSING_INITIAL_STEP, Reason.UNKNOWN_STEP, Reason.BAD_EXPRESSION);
        assertThat(e.getProblems()).anyMatch(p -> p.message().contains("target step 'Missing' not found"));
        assertThat(e.getMessage()).startsWith("Malformed chart (6 problems)");
    }

    @Test
    void missingInitialStep() {
        ChartDescription description = new ChartDescription(
            List.of(new ChartDescription.StepSpec("A", "")), List.of(), List.of(), null);

        MalformedChartException e = catchThrowableOfType(
            () -> SequentialFunctionChart.of(description), MalformedChartException.class);

        assertThat(e.hasReason(Reason.MISSING_INITIAL_STEP)).isTrue();
        assertThat(e.getProblems()).hasSize(1);
    }

    @Test
    void unknownStepLookupFails() {
        SequentialFunctionChart sfc = ChartFixtures.singleStep();

        assertThat(sfc.hasStep("Only")).isTrue();
        assertThat(sfc.hasStep("Other")).isFalse();
        assertThat(catchThrowableOfType(() -> sfc.outgoing("Other"), IllegalArgumentException.class)).isNotNull();
    }
}
