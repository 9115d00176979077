package com.webspec.report;

import com.webspec.model.ExecutionResult;
import com.webspec.model.ScenarioResult;
import com.webspec.model.StepResult;
import com.webspec.model.StepStatus;

/**
 * Test Anything Protocol (version 13) output: one test point per scenario.
 *
 * <pre>
 * TAP version 13
 * 1..2
 * # File: features/login.feature
 * ok 1 Successful login
 * not ok 2 Wrong password
 *   ---
 *   message: |
 *     Step failed: I click on "button.login"
 *   ...
 * </pre>
 *
 * Only passed scenarios are "ok". The YAML block names the first step of a
 * non-passed scenario that did not pass.
 */
public final class TapReportFormatter {

    private TapReportFormatter() {}

    public static String format(ExecutionResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("TAP version 13\n");
        sb.append("1..").append(result.getScenarios().size()).append('\n');
        if (result.getFeature() != null && result.getFeature().getFile() != null) {
            sb.append("# File: ").append(result.getFeature().getFile()).append('\n');
        }

        int number = 1;
        for (ScenarioResult scenario : result.getScenarios()) {
            boolean ok = scenario.getStatus() == StepStatus.PASSED;
            sb.append(ok ? "ok " : "not ok ").append(number++).append(' ').append(scenario.getName()).append('\n');
            if (!ok) {
                scenario.getSteps().stream()
                    .filter(step -> !step.isPassed())
                    .findFirst()
                    .ifPresent(step -> appendDiagnostic(sb, step));
            }
        }
        return sb.toString();
    }

    /** Reads the plan and test point counts back out of TAP text. Unknown lines are ignored. */
    public static TapSummary parse(String tap) {
        String version = "13";
        int total = 0, passed = 0, failed = 0;
        for (String line : tap.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("TAP version")) {
                String[] parts = trimmed.split("\\s+");
                if (parts.length > 2) version = parts[2];
            } else if (trimmed.startsWith("1..")) {
                try {
                    total = Integer.parseInt(trimmed.substring(3).trim());
                } catch (NumberFormatException e) {
                    total = 0;
                }
            } else if (trimmed.startsWith("ok ")) {
                passed++;
            } else if (trimmed.startsWith("not ok ")) {
                failed++;
            }
        }
        return new TapSummary(version, total, passed, failed);
    }

    private static void appendDiagnostic(StringBuilder sb, StepResult step) {
        sb.append("  ---\n");
        sb.append("  message: |\n");
        sb.append("    Step failed: ").append(step.getText()).append('\n');
        if (step.getError() != null && step.getError().getMessage() != null) {
            sb.append("    ").append(step.getError().getMessage()).append('\n');
        }
        sb.append("  ...\n");
    }
}
