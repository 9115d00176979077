package com.webspec.registry;

import com.webspec.catalog.StepCatalog;
import com.webspec.catalog.StepCatalogLoader;
import com.webspec.catalog.StepInfo;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DefaultStepPatternsTest {

    private StepPatternRegistry registry;

    @BeforeClass
    public void setUp() {
        registry = DefaultStepPatterns.build();
    }

    @Test
    public void build_hasNoShadowedDuplicates() {
        assertThat(registry.validate().isOk()).isTrue();
    }

    @Test
    public void build_registersEveryBuiltInIdentifier() {
        assertThat(registry.identifiers()).hasSize(37)
            .contains(StepIds.NAVIGATE_TO, StepIds.CLICK, StepIds.TYPE_TEXT, StepIds.TAKE_SCREENSHOT);
    }

    @Test
    public void click_capturesSelector() {
        StepMatch m = registry.match("I click on \"button.login\"").orElseThrow();

        assertThat(m.identifier()).isEqualTo(StepIds.CLICK);
        assertThat(m.parameters()).containsExactly("button.login");
    }

    @Test
    public void typeText_capturesTextAndSelector() {
        StepMatch m = registry.match("I type \"hello\" into \"#search\"").orElseThrow();

        assertThat(m.identifier()).isEqualTo(StepIds.TYPE_TEXT);
        assertThat(m.parameters()).containsExactly("hello", "#search");
    }

    @Test
    public void screenshot_nameIsOptional() {
        assertThat(registry.match("I take a screenshot").orElseThrow().parameters()).isEmpty();
        assertThat(registry.match("I take a screenshot named \"x\"").orElseThrow().parameters())
            .containsExactly("x");
    }

    @Test
    public void waits_distinguishSecondsFromMilliseconds() {
        assertThat(registry.match("I wait 2 seconds").map(StepMatch::identifier)).contains(StepIds.WAIT_SECONDS);
        assertThat(registry.match("I wait 500 ms").map(StepMatch::identifier)).contains(StepIds.WAIT_MILLISECONDS);
    }

    @Test
    public void everyCatalogExampleMatchesItsOwnIdentifier() {
        StepCatalog catalog = StepCatalogLoader.loadDefault();

        for (StepInfo step : catalog.allSteps()) {
            assertThat(step.getExamples()).as("examples of %s", step.getId()).isNotEmpty();
            for (String example : step.getExamples()) {
                assertThat(registry.match(example).map(StepMatch::identifier))
                    .as("'%s'", example)
                    .contains(step.getId());
            }
        }
    }
}
