package SFC.Chart;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads chart descriptions from JSON in the benchmark layout:
 * <pre>
 * { "steps": [{"name": "Start", "function": "i := 1"}],
 *   "transitions": [{"src": "Start", "tgt": "Check", "guard": "init"}],
 *   "variables": ["i", "n"],
 *   "initial_step": "Start" }
 * </pre>
 * A missing {@code initial_step} defaults to the first declared step.
 */
public final class ChartLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ChartLoader() {}

    public static SequentialFunctionChart loadFromFile(Path path) throws IOException, MalformedChartException {
        return SequentialFunctionChart.of(describe(MAPPER.readTree(path.toFile()), path.toString()));
    }

    public static SequentialFunctionChart loadFromString(String json) throws IOException, MalformedChartException {
        return SequentialFunctionChart.of(describe(MAPPER.readTree(json), "<string>"));
    }

    /**
     * Load every {@code *.json} chart of a directory, keyed by file name without extension.
     */
    public static Map<String, SequentialFunctionChart> loadFromDirectory(Path dir)
        throws IOException, MalformedChartException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(p -> p.toString().endsWith(".json")).sorted().toList();
        }
        Map<String, SequentialFunctionChart> charts = new LinkedHashMap<>();
        for (Path p : files) {
            String name = p.getFileName().toString();
            charts.put(name.substring(0, name.length() - ".json".length()), loadFromFile(p));
        }
        return charts;
    }

    static ChartDescription describe(JsonNode root, String source) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Chart " + source + " is not a JSON object");
        }
        List<ChartDescription.StepSpec> steps = new ArrayList<>();
        for (JsonNode node : array(root, "steps", source)) {
            steps.add(new ChartDescription.StepSpec(text(node, "name"), text(node, "function")));
        }

        List<ChartDescription.TransitionSpec> transitions = new ArrayList<>();
        if (root.has("transitions")) {
            for (JsonNode node : array(root, "transitions", source)) {
                transitions.add(new ChartDescription.TransitionSpec(
                    text(node, "src"), text(node, "tgt"), text(node, "guard")));
            }
        }

        List<String> variables = new ArrayList<>();
        if (root.has("variables")) {
            array(root, "variables", source).forEach(v -> variables.add(v.asText()));
        }

        String initial = text(root, "initial_step");
        if (initial == null && !steps.isEmpty()) {
            initial = steps.get(0).name();
        }
        return new ChartDescription(steps, transitions, variables, initial);
    }

    private static JsonNode array(JsonNode root, String field, String source) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new IOException("Chart " + source + ": '" + field + "' must be an array");
        }
        return node;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
