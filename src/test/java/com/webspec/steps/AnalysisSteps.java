package com.webspec.steps;

import com.webspec.alerts.AlertSeverity;
import com.webspec.alerts.PerformanceAlert;
import com.webspec.catalog.ValidationIssue;
import com.webspec.comparison.ComparisonStatus;
import com.webspec.comparison.RegressionItem;
import com.webspec.comparison.Severity;
import com.webspec.context.ScenarioContext;
import com.webspec.model.ExecutionResult;
import com.webspec.model.ScenarioResult;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static com.webspec.support.ResultFixtures.failed;
import static com.webspec.support.ResultFixtures.feature;
import static com.webspec.support.ResultFixtures.passed;
import static com.webspec.support.ResultFixtures.step;
import static com.webspec.support.ResultFixtures.withSteps;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Comparison, alerting and validation through the client.
 *
 * Steps covered:
 *   Given a baseline run where "..." passed in Nms
 *   When the current run has "..." passing|failing in Nms
 *   Then the comparison status should be "..."
 *   Then the regression for "..." should be "..."
 *   Given the monitor recorded a scenario "..." taking Nms
 *   When the alerts are evaluated
 *   Then the raised alerts should be "..."
 *   Then no alert should be critical
 *   When I validate the feature:
 *   Then the validation should report N error(s)
 *   Then the first error should suggest "..."
 */
public class AnalysisSteps {

    private final ScenarioContext ctx;

    public AnalysisSteps(ScenarioContext ctx) {
        this.ctx = ctx;
    }

    // ── Comparison ────────────────────────────────────────────────────────────

    @Given("a baseline run where {string} passed in {long}ms")
    public void aBaselineRunWherePassedIn(String scenario, long durationMs) {
        ctx.setBaseline(feature("baseline", passed(scenario, durationMs)));
    }

    @When("the current run has {string} {word} in {long}ms")
    public void theCurrentRunHasIn(String scenario, String outcome, long durationMs) {
        ScenarioResult current = switch (outcome) {
            case "passing" -> passed(scenario, durationMs);
            case "failing" -> failed(scenario, durationMs);
            default        -> throw new IllegalArgumentException("Expected passing or failing, got " + outcome);
        };
        ExecutionResult result = feature("baseline", current);
        ctx.setLastResult(result);
        ctx.setComparison(ctx.getClient().compare(ctx.getBaseline(), result));
    }

    @Then("the comparison status should be {string}")
    public void theComparisonStatusShouldBe(String status) {
        assertThat(ctx.getComparison().status())
            .isEqualTo(ComparisonStatus.valueOf(status.toUpperCase(Locale.ROOT)));
    }

    @Then("the regression for {string} should be {string}")
    public void theRegressionForShouldBe(String scenario, String severity) {
        List<RegressionItem> regressions = ctx.getComparison().regressionsForScenario(scenario);
        assertThat(regressions).extracting(RegressionItem::severity)
            .containsExactly(Severity.valueOf(severity.toUpperCase(Locale.ROOT)));
    }

    // ── Alerts ────────────────────────────────────────────────────────────────

    @Given("the monitor recorded a scenario {string} taking {long}ms")
    public void theMonitorRecordedAScenarioTaking(String name, long durationMs) {
        // five equal steps keep the step average below the slow-step threshold
        long each = durationMs / 5;
        ctx.getClient().getMonitor().recordScenario(withSteps(name,
            step("I open the cart", each), step("I click \"#checkout\"", each),
            step("I type the card number", each), step("I click \"#pay\"", each),
            step("I wait for the receipt", durationMs - 4 * each)));
    }

    @When("the alerts are evaluated")
    public void theAlertsAreEvaluated() {
        ctx.setAlerts(ctx.getClient().evaluateAlerts());
    }

    @Then("the raised alerts should be {string}")
    public void theRaisedAlertsShouldBe(String names) {
        List<String> expected = names.isBlank() ? List.of() : Arrays.stream(names.split(","))
            .map(String::trim)
            .toList();
        assertThat(ctx.getAlerts()).extracting(PerformanceAlert::thresholdName)
            .containsExactlyElementsOf(expected);
    }

    @Then("no alert should be critical")
    public void noAlertShouldBeCritical() {
        assertThat(ctx.getAlerts()).noneMatch(a -> a.severity() == AlertSeverity.CRITICAL);
    }

    // ── Validation ────────────────────────────────────────────────────────────

    @When("I validate the feature:")
    public void iValidateTheFeature(String content) {
        ctx.setValidation(ctx.getClient().validate(content));
    }

    @Then("the validation should report {int} error(s)")
    public void theValidationShouldReportErrors(int count) {
        assertThat(ctx.getValidation().errorCount()).isEqualTo(count);
    }

    @Then("the first error should suggest {string}")
    public void theFirstErrorShouldSuggest(String prefix) {
        ValidationIssue first = ctx.getValidation().getErrors().get(0);
        assertThat(first.getSuggestions()).anyMatch(s -> s.startsWith(prefix));
    }
}
