package com.webspec.catalog;

import com.webspec.registry.DefaultStepPatterns;
import com.webspec.registry.StepPatternRegistry;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StepCatalogTest {

    private StepCatalog catalog;

    @BeforeClass
    public void setUp() {
        catalog = StepCatalogLoader.loadDefault();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Bundled catalog
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void loadDefault_containsAllCategories() {
        assertThat(catalog.totalSteps()).isEqualTo(37);
        assertThat(catalog.categories())
            .containsExactly("data", "interaction", "navigation", "scrolling", "verification", "waiting");
    }

    @Test
    public void findById_returnsStepWithParameters() {
        StepInfo click = catalog.findById("click").orElseThrow();

        assertThat(click.getCategory()).isEqualTo("interaction");
        assertThat(click.getParameters()).extracting(ParameterInfo::getName).containsExactly("selector");
        assertThat(catalog.findById("does_not_exist")).isEmpty();
    }

    @Test
    public void findByCategory_ignoresCase() {
        assertThat(catalog.findByCategory("NAVIGATION"))
            .extracting(StepInfo::getId)
            .contains("navigate_to", "go_back");
    }

    @Test
    public void registryAndCatalogAreConsistent() {
        StepPatternRegistry registry = DefaultStepPatterns.build();

        assertThat(CatalogConsistencyChecker.check(registry, catalog)).isEmpty();
    }

    @Test
    public void consistencyChecker_reportsUnknownIdAndUnlistedPattern() {
        StepPatternRegistry registry = new StepPatternRegistry()
            .register("I teleport to \"([^\"]+)\"", "teleport")
            .register("I smash \"([^\"]+)\"", "click");

        List<CatalogConsistencyChecker.Inconsistency> problems = CatalogConsistencyChecker.check(registry, catalog);

        assertThat(problems).extracting(CatalogConsistencyChecker.Inconsistency::identifier)
            .containsExactly("teleport", "click");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Search
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void search_matchesDescriptionIgnoringCase() {
        assertThat(StepSearch.search(catalog.allSteps(), "SCREENSHOT"))
            .extracting(StepInfo::getId)
            .contains("take_screenshot");
    }

    @Test
    public void search_blankQueryReturnsEverything() {
        assertThat(StepSearch.search(catalog.allSteps(), "  ")).hasSize(catalog.totalSteps());
    }

    @Test
    public void filterByCategory_keepsOnlyThatCategory() {
        assertThat(StepSearch.filterByCategory(catalog.allSteps(), "scrolling"))
            .extracting(StepInfo::getCategory)
            .containsOnly("scrolling");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Loading from disk
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void load_readsCustomCatalogFile() throws IOException {
        Path file = Files.createTempFile("catalog", ".json");
        Files.writeString(file, """
            {"version": "1.0", "steps": [
              {"id": "go_back", "category": "navigation", "description": "Back",
               "pattern": "I go back", "examples": ["I go back"]}
            ]}
            """);

        StepCatalog loaded = StepCatalogLoader.load(file);

        assertThat(loaded.totalSteps()).isEqualTo(1);
        assertThat(loaded.findById("go_back")).isPresent();
    }

    @Test
    public void load_malformedFileThrows() throws IOException {
        Path file = Files.createTempFile("catalog", ".json");
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> StepCatalogLoader.load(file)).isInstanceOf(IOException.class);
    }
}
