package com.webspec.catalog;

import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class StepValidatorTest {

    private StepValidator validator;

    @BeforeClass
    public void setUp() {
        validator = new StepValidator(StepCatalogLoader.loadDefault());
    }

    @Test
    public void validateStep_knownStepHasNoIssue() {
        assertThat(validator.validateStep("I click on \"#submit\"", 1)).isEmpty();
        assertThat(validator.validateStep("the page should contain \"Welcome\"", 2)).isEmpty();
    }

    @Test
    public void validateStep_unknownStepCarriesNumberTextAndHints() {
        Optional<ValidationIssue> issue = validator.validateStep("I click the big red button", 4);

        assertThat(issue).isPresent();
        assertThat(issue.get().getCode()).isEqualTo(ValidationIssue.UNKNOWN_STEP);
        assertThat(issue.get().getStepNumber()).isEqualTo(4);
        assertThat(issue.get().getStepText()).isEqualTo("I click the big red button");
        assertThat(issue.get().getSuggestions())
            .anyMatch(s -> s.startsWith("For clicking elements"));
    }

    @Test
    public void validateStep_suggestsStepsWithSimilarDescriptions() {
        Optional<ValidationIssue> issue = validator.validateStep("verify page title equals something", 1);

        assertThat(issue).isPresent();
        assertThat(issue.get().getSuggestions()).anyMatch(s -> s.startsWith("Did you mean:"));
    }

    @Test
    public void validateFeatureContent_validFeature() {
        String feature = """
            Feature: Login
              # comments are ignored
              Scenario: Happy path
                Given I navigate to "https://example.com/login"
                When I type "alice" into "#user"
                And I click on "button.login"
                Then I should see "Welcome"
            """;

        ValidationResult result = validator.validateFeatureContent(feature);

        assertThat(result.isValid()).isTrue();
        assertThat(result.warningCount()).isZero();
    }

    @Test
    public void validateFeatureContent_missingFeatureIsErrorAndNoScenarioIsWarning() {
        ValidationResult result = validator.validateFeatureContent("Given I go back\n");

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).extracting(ValidationIssue::getCode)
            .containsExactly(ValidationIssue.MISSING_FEATURE);
        assertThat(result.getWarnings()).extracting(ValidationIssue::getCode)
            .containsExactly(ValidationIssue.NO_SCENARIOS);
    }

    @Test
    public void validateFeatureContent_numbersStepsAcrossScenarios() {
        String feature = """
            Feature: Mixed
              Scenario: One
                Given I go back
              Scenario: Two
                When I do something nobody registered
            """;

        ValidationResult result = validator.validateFeatureContent(feature);

        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(result.getErrors().get(0).getStepNumber()).isEqualTo(2);
    }
}
