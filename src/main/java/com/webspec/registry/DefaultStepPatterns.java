package com.webspec.registry;

import java.util.List;

/**
 * Builds the registry of built-in browser steps.
 *
 * <p>Registration order matters: matching is first-wins and unanchored, so a
 * general pattern must come after the specific ones it would shadow. Every pattern here
 * also appears in {@code step-catalog.json} under the same identifier, either
 * as the catalog pattern or as one of its aliases.
 */
public final class DefaultStepPatterns {

    private DefaultStepPatterns() {}

    public static StepPatternRegistry build() {
        StepPatternRegistry registry = new StepPatternRegistry();
        // ── Navigation ──────────────────────────────────────────────────────────────
        registry.register(StepIds.NAVIGATE_TO, "I (?:navigate to|go to|open) \"([^\"]+)\"",
            List.of("I am on \"([^\"]+)\""));
        registry.register(StepIds.GO_BACK, "I go back",
            List.of("I navigate back"));
        registry.register(StepIds.GO_FORWARD, "I go forward", List.of());
        registry.register(StepIds.REFRESH_PAGE, "I refresh the page",
            List.of("I reload the page"));
        registry.register(StepIds.WAIT_FOR_PAGE_LOAD, "I wait for the page to load", List.of());

        // ── Waiting ─────────────────────────────────────────────────────────────────
        registry.register(StepIds.WAIT_SECONDS, "I wait (\\d+) seconds?",
            List.of("I wait for (\\d+) seconds?"));
        registry.register(StepIds.WAIT_MILLISECONDS, "I wait (\\d+) (?:ms|milliseconds)", List.of());
        registry.register(StepIds.WAIT_FOR_ELEMENT, "I wait for \"([^\"]+)\" to be visible",
            List.of("I wait for element \"([^\"]+)\""));
        registry.register(StepIds.WAIT_FOR_ELEMENT_HIDDEN, "I wait for \"([^\"]+)\" to disappear", List.of());
        registry.register(StepIds.WAIT_FOR_TEXT, "I wait for text \"([^\"]+)\"", List.of());

        // ── Interaction ─────────────────────────────────────────────────────────────
        registry.register(StepIds.CLICK, "I click (?:on )?\"([^\"]+)\"",
            List.of("I press \"([^\"]+)\""));
        registry.register(StepIds.DOUBLE_CLICK, "I double[- ]click (?:on )?\"([^\"]+)\"", List.of());
        registry.register(StepIds.RIGHT_CLICK, "I right[- ]click (?:on )?\"([^\"]+)\"", List.of());
        registry.register(StepIds.HOVER, "I hover over \"([^\"]+)\"", List.of());
        registry.register(StepIds.TYPE_TEXT, "I (?:type|enter) \"([^\"]*)\" into \"([^\"]+)\"",
            List.of("I input \"([^\"]*)\" into \"([^\"]+)\""));
        registry.register(StepIds.CLEAR_FIELD, "I clear \"([^\"]+)\"", List.of());
        registry.register(StepIds.SELECT_OPTION, "I select \"([^\"]+)\" from \"([^\"]+)\"", List.of());
        registry.register(StepIds.CHECK_CHECKBOX, "I check \"([^\"]+)\"", List.of());
        registry.register(StepIds.UNCHECK_CHECKBOX, "I uncheck \"([^\"]+)\"", List.of());
        registry.register(StepIds.PRESS_KEY, "I press the \"([^\"]+)\" key", List.of());

        // ── Scrolling ───────────────────────────────────────────────────────────────
        registry.register(StepIds.SCROLL_TO_BOTTOM, "I scroll to the bottom", List.of());
        registry.register(StepIds.SCROLL_TO_TOP, "I scroll to the top", List.of());
        registry.register(StepIds.SCROLL_TO_ELEMENT, "I scroll to \"([^\"]+)\"", List.of());

        // ── Verification ────────────────────────────────────────────────────────────
        registry.register(StepIds.SHOULD_SEE_TEXT, "I should see \"([^\"]+)\"",
            List.of("the page should contain \"([^\"]+)\""));
        registry.register(StepIds.SHOULD_NOT_SEE_TEXT, "I should not see \"([^\"]+)\"", List.of());
        registry.register(StepIds.ELEMENT_VISIBLE, "the element \"([^\"]+)\" should be visible",
            List.of("I should see the element \"([^\"]+)\""));
        registry.register(StepIds.ELEMENT_NOT_VISIBLE, "the element \"([^\"]+)\" should not be visible", List.of());
        registry.register(StepIds.ELEMENT_TEXT_EQUALS, "the element \"([^\"]+)\" should have text \"([^\"]*)\"", List.of());
        registry.register(StepIds.ELEMENT_CONTAINS_TEXT, "the element \"([^\"]+)\" should contain \"([^\"]+)\"", List.of());
        registry.register(StepIds.TITLE_EQUALS, "the (?:page )?title should be \"([^\"]+)\"", List.of());
        registry.register(StepIds.TITLE_CONTAINS, "the (?:page )?title should contain \"([^\"]+)\"", List.of());
        registry.register(StepIds.URL_CONTAINS, "the (?:url|URL) should contain \"([^\"]+)\"", List.of());

        // ── Stored and extracted values ─────────────────────────────────────────────
        registry.register(StepIds.STORE_TEXT, "I store the text of \"([^\"]+)\" as \"([^\"]+)\"", List.of());
        registry.register(StepIds.EXTRACT_ALL_TEXT, "I extract all text from \"([^\"]+)\" as \"([^\"]+)\"", List.of());
        registry.register(StepIds.STORED_VALUE_EQUALS, "the stored value \"([^\"]+)\" should be \"([^\"]*)\"", List.of());
        registry.register(StepIds.EXTRACTED_COUNT_EQUALS, "the extracted list \"([^\"]+)\" should have (\\d+) items?", List.of());
        registry.register(StepIds.TAKE_SCREENSHOT, "I take a screenshot(?: named \"([^\"]+)\")?", List.of());

        return registry;
    }
}
