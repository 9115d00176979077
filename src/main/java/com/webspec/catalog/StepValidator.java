package com.webspec.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Checks step texts and raw feature content against a {@link StepCatalog}
 * before anything is executed.
 *
 * <p>A step is known when the catalog pattern or any alias of some catalog step
 * is found in its text. Unknown steps are reported as {@code UNKNOWN_STEP} with
 * "Did you mean" suggestions (catalog ids whose description shares at least
 * two words with the step) plus keyword hints for clicking, typing and
 * assertions.
 */
public class StepValidator {

    private static final Logger log = LoggerFactory.getLogger(StepValidator.class);

    private static final List<String> STEP_KEYWORDS = List.of("Given ", "When ", "Then ", "And ", "But ");
    private static final int MAX_SUGGESTIONS = 3;

    private final StepCatalog   catalog;
    private final List<Pattern> compiled = new ArrayList<>();

    public StepValidator(StepCatalog catalog) {
        this.catalog = catalog;
        for (StepInfo step : catalog.allSteps()) {
            for (String source : step.getAllPatterns()) {
                try {
                    compiled.add(Pattern.compile(source));
                } catch (PatternSyntaxException e) {
                    log.warn("StepValidator: catalog step '{}' has an invalid pattern /{}/ - ignored",
                        step.getId(), source);
                }
            }
        }
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Returns an {@code UNKNOWN_STEP} issue when no catalog pattern matches the
     * text, or empty when the step is known.
     */
    public Optional<ValidationIssue> validateStep(String stepText, int stepNumber) {
        if (compiled.stream().anyMatch(p -> p.matcher(stepText).find())) {
            return Optional.empty();
        }

        ValidationIssue issue = new ValidationIssue(ValidationIssue.UNKNOWN_STEP,
            "Step '" + stepText + "' does not match any registered pattern", stepNumber, stepText);

        List<String> similar = findSimilarSteps(stepText);
        if (!similar.isEmpty()) {
            issue.addSuggestion("Did you mean: " + String.join(" or ", similar) + "?");
        }

        String lower = stepText.toLowerCase(Locale.ROOT);
        if (lower.contains("click")) {
            issue.addSuggestion("For clicking elements, try: 'I click on \"selector\"'");
        }
        if (lower.contains("type")) {
            issue.addSuggestion("For typing into fields, try: 'I type \"text\" into \"selector\"'");
        }
        if (lower.contains("should")) {
            issue.addSuggestion("For assertions, try: 'the element \"selector\" should be visible' "
                + "or 'the page should contain \"text\"'");
        }
        if (similar.isEmpty()) {
            issue.addSuggestion("List the step catalog to see all available step patterns");
        }
        return Optional.of(issue);
    }

    /**
     * Validates raw feature text: requires a {@code Feature:} declaration, warns
     * when no {@code Scenario:} is present, and validates every step line
     * (lines starting with Given/When/Then/And/But; comments are ignored).
     */
    public ValidationResult validateFeatureContent(String content) {
        ValidationResult result = new ValidationResult();
        String upper = content.toUpperCase(Locale.ROOT);

        if (!upper.contains("FEATURE:")) {
            result.addError(new ValidationIssue(ValidationIssue.MISSING_FEATURE,
                "Feature file must start with 'Feature:' declaration"));
        }
        if (!upper.contains("SCENARIO:")) {
            result.addWarning(new ValidationIssue(ValidationIssue.NO_SCENARIOS,
                "Feature file contains no scenarios"));
        }

        int stepNumber = 0;
        for (String line : content.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

            Optional<String> keyword = STEP_KEYWORDS.stream().filter(trimmed::startsWith).findFirst();
            if (keyword.isEmpty()) continue;

            stepNumber++;
            String stepText = trimmed.substring(keyword.get().length()).trim();
            validateStep(stepText, stepNumber).ifPresent(result::addError);
        }

        log.debug("StepValidator: {} step line(s) checked, {} error(s), {} warning(s)",
            stepNumber, result.errorCount(), result.warningCount());
        return result;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private List<String> findSimilarSteps(String stepText) {
        List<String> words = Arrays.asList(stepText.toLowerCase(Locale.ROOT).split("\\s+"));

        return catalog.allSteps().stream()
            .map(step -> {
                Set<String> described = Arrays.stream(
                        (step.getDescription() != null ? step.getDescription() : "")
                            .toLowerCase(Locale.ROOT).split("\\s+"))
                    .collect(Collectors.toSet());
                long shared = words.stream().filter(described::contains).count();
                return new AbstractMap.SimpleEntry<>(step.getId(), shared);
            })
            .filter(e -> e.getValue() >= 2)
            .sorted(Comparator.comparing(Map.Entry<String, Long>::getValue).reversed())
            .limit(MAX_SUGGESTIONS)
            .map(Map.Entry::getKey)
            .toList();
    }
}
