package com.webspec.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webspec.model.ExecutionResult;
import com.webspec.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads execution reports written by {@link ExecutionReportWriter} (or any tool
 * producing the same JSON/YAML layout). Files ending in .yaml or .yml are read
 * as YAML, everything else as JSON. Status and summary are recomputed from the
 * scenarios on load.
 */
public final class ExecutionReportReader {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReportReader.class);

    private ExecutionReportReader() {}

    public static ExecutionResult read(Path path) throws ReportParseException {
        if (!Files.isRegularFile(path)) {
            throw new ReportParseException(path, "Report not found: " + path, null);
        }
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ReportParseException(path, "Cannot read report " + path + ": " + e.getMessage(), e);
        }
        ExecutionResult result = parse(content, JsonSupport.forPath(path), path);
        log.debug("ExecutionReportReader: loaded '{}' from {}",
            result.getFeature() != null ? result.getFeature().getName() : "?", path);
        return result;
    }

    /** Parses JSON report content held in memory. */
    public static ExecutionResult readJson(String content) throws ReportParseException {
        return parse(content, JsonSupport.json(), null);
    }

    private static ExecutionResult parse(String content, ObjectMapper mapper, Path path)
            throws ReportParseException {
        String source = path != null ? path.toString() : "<input>";
        if (content == null || content.isBlank()) {
            throw new ReportParseException(path, "Report " + source + " is empty", null);
        }
        try {
            JsonNode tree = mapper.readTree(content);
            if (tree == null || !tree.isObject() || !tree.has("feature")) {
                throw new ReportParseException(path, "Report " + source + " has no feature section", null);
            }
            return mapper.treeToValue(tree, ExecutionResult.class);
        } catch (JsonProcessingException e) {
            throw new ReportParseException(path,
                "Malformed report " + source + ": " + e.getOriginalMessage(), e);
        }
    }
}
