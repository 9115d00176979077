package com.webspec.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Shared Jackson mappers for reports, the step catalog and alert/webhook configs.
 * Instants are written as ISO-8601 strings.
 */
public final class JsonSupport {

    private static final ObjectMapper JSON = configure(new ObjectMapper());
    private static final ObjectMapper YAML = configure(new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)));

    private JsonSupport() {}

    public static ObjectMapper json() { return JSON; }
    public static ObjectMapper yaml() { return YAML; }

    /** YAML mapper for {@code .yaml}/{@code .yml} files, JSON mapper otherwise. */
    public static ObjectMapper forPath(Path path) {
        return isYaml(path) ? YAML : JSON;
    }

    public static boolean isYaml(Path path) {
        String name = path.getFileName() != null
            ? path.getFileName().toString().toLowerCase(Locale.ROOT) : "";
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
