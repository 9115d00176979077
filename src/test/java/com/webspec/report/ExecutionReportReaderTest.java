package com.webspec.report;

import com.webspec.model.ExecutionResult;
import com.webspec.model.ScenarioResult;
import com.webspec.model.StepStatus;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static com.webspec.support.ResultFixtures.T0;
import static com.webspec.support.ResultFixtures.failed;
import static com.webspec.support.ResultFixtures.feature;
import static com.webspec.support.ResultFixtures.passed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ExecutionReportReaderTest {

    private Path dir;

    @BeforeClass
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("reports");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Reading
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void read_recomputesStatusAndSummaryFromScenarios() throws Exception {
        Path fixture = Paths.get(getClass().getResource("/fixtures/login-report.json").toURI());

        ExecutionResult result = ExecutionReportReader.read(fixture);

        assertThat(result.getFeature().getName()).isEqualTo("Login");
        assertThat(result.getTimestamp()).isEqualTo(T0);
        assertThat(result.getDurationMs()).isEqualTo(3400);
        assertThat(result.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(result.getSummary().getPassedScenarios()).isEqualTo(1);
        assertThat(result.getSummary().getFailedScenarios()).isEqualTo(1);
        assertThat(result.getSummary().getSkippedSteps()).isEqualTo(1);
        assertThat(result.getScenarios().get(1).getSteps().get(1).getError().getMessage())
            .isEqualTo("Element not found: button.login");
    }

    @Test
    public void read_missingFile() {
        assertThatThrownBy(() -> ExecutionReportReader.read(dir.resolve("absent.json")))
            .isInstanceOf(ReportParseException.class)
            .hasMessageStartingWith("Report not found");
    }

    @Test
    public void read_emptyFile() throws IOException {
        Path empty = Files.writeString(dir.resolve("empty.json"), "  \n");

        assertThatThrownBy(() -> ExecutionReportReader.read(empty))
            .isInstanceOf(ReportParseException.class)
            .hasMessageEndingWith("is empty");
    }

    @Test
    public void read_malformedJson() throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.json"), "{\"feature\": {\"name\": ");

        assertThatThrownBy(() -> ExecutionReportReader.read(broken))
            .isInstanceOf(ReportParseException.class)
            .hasMessageStartingWith("Malformed report")
            .satisfies(e -> assertThat(((ReportParseException) e).getPath()).isEqualTo(broken));
    }

    @Test
    public void readJson_withoutFeatureSection() {
        assertThatThrownBy(() -> ExecutionReportReader.readJson("{\"scenarios\": []}"))
            .isInstanceOf(ReportParseException.class)
            .hasMessageContaining("has no feature section");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Writing
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void write_thenReadGivesTheSameOutcome() throws Exception {
        ExecutionResult original = feature("checkout", passed("Pay", 1_500), failed("Refund", 700));
        Path target = dir.resolve("nested/out/checkout.json");

        ExecutionReportWriter.write(original, target);
        ExecutionResult reloaded = ExecutionReportReader.read(target);

        assertThat(Files.exists(target.resolveSibling("checkout.json.tmp"))).isFalse();
        assertThat(reloaded.getStatus()).isEqualTo(original.getStatus());
        assertThat(reloaded.getSummary()).usingRecursiveComparison().isEqualTo(original.getSummary());
        assertThat(reloaded.getScenarios()).extracting(ScenarioResult::getName).containsExactly("Pay", "Refund");
    }

    @Test
    public void write_yamlTarget() throws Exception {
        ExecutionResult original = feature("search", passed("Find", 300));
        Path target = dir.resolve("search.yaml");

        ExecutionReportWriter.write(original, target);

        assertThat(Files.readString(target)).contains("feature:").contains("duration_ms: 300");
        assertThat(ExecutionReportReader.read(target).getStatus()).isEqualTo(StepStatus.PASSED);
    }

    @Test
    public void toJson_usesSnakeCaseKeys() {
        String json = ExecutionReportWriter.toJson(feature("login", passed("Valid", 10)));

        assertThat(json).contains("\"duration_ms\"").contains("\"summary\"").contains("\"step\"");
    }
}
