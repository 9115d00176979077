package com.webspec.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.webspec.util.JsonSupport;

import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Renders a {@link BatchResult} as text, JSON or YAML. Unknown formats fall
 * back to text.
 */
public final class BatchReportFormatter {

    private BatchReportFormatter() {}

    public static String format(BatchResult result, String format) {
        return switch (format == null ? "text" : format.toLowerCase(Locale.ROOT)) {
            case "json"        -> write(JsonSupport.json(), result);
            case "yaml", "yml" -> write(JsonSupport.yaml(), result);
            default            -> toText(result);
        };
    }

    public static String toText(BatchResult result) {
        StringBuilder out = new StringBuilder();
        out.append("=== Batch Execution Summary ===\n\n");
        out.append(String.format("Features:  %d total, %d passed, %d failed%n",
            result.getTotalFeatures(), result.getPassedFeatures(), result.getFailedFeatures()));
        out.append(String.format("Scenarios: %d total, %d passed, %d failed%n",
            result.getTotalScenarios(), result.getPassedScenarios(), result.getFailedScenarios()));
        out.append(String.format("Duration:  %dms%n%n", result.getTotalDurationMs()));

        out.append("=== Feature Results ===\n");
        for (FeatureResult f : result.getResults()) {
            out.append(String.format("%s %s - %s (%dms)%n",
                f.isPassed() ? "✓" : "✗", f.getName(), f.getStatus().wireName(), f.getDurationMs()));
            if (f.getScenariosFailed() > 0) {
                out.append(String.format("    Failed: %d/%d scenarios%n",
                    f.getScenariosFailed(), f.getScenariosPassed() + f.getScenariosFailed()));
            }
        }

        if (!result.getErrors().isEmpty()) {
            out.append("\n=== Errors ===\n");
            for (BatchError e : result.getErrors()) {
                out.append(String.format("✗ %s - %s%n", e.path(), e.message()));
            }
        }
        return out.toString();
    }

    static ObjectNode toTree(ObjectMapper mapper, BatchResult result) {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode summary = root.putObject("batch_summary");
        summary.put("total_features",   result.getTotalFeatures());
        summary.put("passed_features",  result.getPassedFeatures());
        summary.put("failed_features",  result.getFailedFeatures());
        summary.put("total_scenarios",  result.getTotalScenarios());
        summary.put("passed_scenarios", result.getPassedScenarios());
        summary.put("failed_scenarios", result.getFailedScenarios());
        summary.put("duration_ms",      result.getTotalDurationMs());

        ArrayNode features = root.putArray("features");
        for (FeatureResult f : result.getResults()) {
            ObjectNode node = features.addObject();
            node.put("name",             f.getName());
            node.put("path",             f.getPath().toString());
            node.put("status",           f.getStatus().wireName());
            node.put("scenarios_passed", f.getScenariosPassed());
            node.put("scenarios_failed", f.getScenariosFailed());
            node.put("duration_ms",      f.getDurationMs());
        }

        ArrayNode errors = root.putArray("errors");
        for (BatchError e : result.getErrors()) {
            ObjectNode node = errors.addObject();
            node.put("path",      e.path().toString());
            node.put("error",     e.message());
            node.put("timestamp", e.timestamp().toString());
        }
        return root;
    }

    private static String write(ObjectMapper mapper, BatchResult result) {
        try {
            return mapper.writeValueAsString(toTree(mapper, result));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize batch result", e);
        }
    }
}
