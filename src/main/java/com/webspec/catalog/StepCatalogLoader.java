package com.webspec.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webspec.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a {@link StepCatalog} from JSON (or YAML) of the form
 * {@code {"version": "...", "steps": [StepInfo...]}}.
 *
 * The built-in catalog ships as the classpath resource {@value #DEFAULT_RESOURCE}.
 */
public final class StepCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(StepCatalogLoader.class);

    public static final String DEFAULT_RESOURCE = "step-catalog.json";

    private StepCatalogLoader() {}

    public static StepCatalog loadDefault() {
        try (InputStream in = StepCatalogLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Step catalog resource not found: " + DEFAULT_RESOURCE);
            }
            return toCatalog(JsonSupport.json().readValue(in, CatalogDocument.class), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read step catalog resource " + DEFAULT_RESOURCE, e);
        }
    }

    public static StepCatalog load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Step catalog not found: " + path);
        }
        ObjectMapper mapper = JsonSupport.forPath(path);
        return toCatalog(mapper.readValue(path.toFile(), CatalogDocument.class), path.toString());
    }

    private static StepCatalog toCatalog(CatalogDocument doc, String source) {
        StepCatalog catalog = new StepCatalog(doc.steps != null ? doc.steps : List.of());
        log.info("StepCatalogLoader: loaded {} step(s) in {} categories from {}",
            catalog.totalSteps(), catalog.categories().size(), source);
        return catalog;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CatalogDocument {
        public String         version;
        public List<StepInfo> steps = new ArrayList<>();
    }
}
