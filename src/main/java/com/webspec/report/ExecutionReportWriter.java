package com.webspec.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.webspec.model.ExecutionResult;
import com.webspec.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Writes execution results as JSON, or YAML when the target ends in .yaml/.yml. */
public final class ExecutionReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReportWriter.class);

    private ExecutionReportWriter() {}

    public static String toJson(ExecutionResult result) {
        try {
            return JsonSupport.json().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise execution result: " + e.getOriginalMessage(), e);
        }
    }

    public static String toYaml(ExecutionResult result) {
        try {
            return JsonSupport.yaml().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise execution result: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Writes {@code result} to {@code path}, creating parent directories. The
     * file is written to a sibling temp file first and moved into place.
     */
    public static void write(ExecutionResult result, Path path) throws IOException {
        String content = JsonSupport.isYaml(path) ? toYaml(result) : toJson(result);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, content);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        log.info("ExecutionReportWriter: wrote {} ({} scenario(s))", path, result.getScenarios().size());
    }
}
