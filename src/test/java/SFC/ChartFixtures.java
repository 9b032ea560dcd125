package SFC;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

import SFC.Chart.ChartDescription;
import SFC.Chart.ChartLoader;
import SFC.Chart.SequentialFunctionChart;
import SFC.PetriNet.PetriNet;
import SFC.PetriNet.PetriNetBuilder;

/**
 * Charts shared by the tests.
 */
public final class ChartFixtures {

  private ChartFixtures() {}

  public static Path getFilePath(String resourcePath) throws URISyntaxException {
    return Paths.get(Objects.requireNonNull(
        ChartFixtures.class.getClassLoader().getResource(resourcePath)).toURI());
  }

  /** Load {@code charts/<name>.json}. */
  public static SequentialFunctionChart chart(String name) {
    try {
      return ChartLoader.loadFromFile(getFilePath("charts/" + name + ".json"));
    } catch (Exception e) {
      throw new IllegalStateException("Cannot load fixture " + name, e);
    }
  }

  public static PetriNet net(String name) {
    return PetriNetBuilder.build(chart(name));
  }

  public static SequentialFunctionChart of(ChartDescription description) {
    try {
      return SequentialFunctionChart.of(description);
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  /** One step, no transitions. */
  public static SequentialFunctionChart singleStep() {
    return of(ChartDescription.builder().step("Only", "x := 1").variables("x").initialStep("Only").build());
  }

  /** One step looping on itself. */
  public static SequentialFunctionChart selfLoop() {
    return of(ChartDescription.builder()
        .step("S", "x := x + 1")
        .transition("S", "S", "x < 3")
        .variables("x")
        .initialStep("S")
        .build());
  }

  /** Factorial with a bookkeeping step between Start and Check. */
  public static SequentialFunctionChart factorialWithPrepare() {
    return of(ChartDescription.builder()
        .step("Start", "i := 1; fact := 1")
        .step("Prepare", "scratch := 0")
        .step("Check", "")
        .step("Multiply", "fact := fact * i")
        .step("Increment", "i := i + 1")
        .step("End", "")
        .transition("Start", "Prepare", "init")
        .transition("Prepare", "Check", "True")
        .transition("Check", "Multiply", "i <= n")
        .transition("Multiply", "Increment", "True")
        .transition("Increment", "Check", "True")
        .transition("Check", "End", "i > n")
        .variables("i", "fact", "n", "init", "scratch")
        .initialStep("Start")
        .build());
  }
}
