package com.webspec.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An error or warning produced while validating step texts or feature content.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationIssue {

    public static final String UNKNOWN_STEP    = "UNKNOWN_STEP";
    public static final String MISSING_FEATURE = "MISSING_FEATURE";
    public static final String NO_SCENARIOS    = "NO_SCENARIOS";

    private final String       code;
    private final String       message;
    private final Integer      stepNumber;
    private final String       stepText;
    private final List<String> suggestions = new ArrayList<>();

    public ValidationIssue(String code, String message) {
        this(code, message, null, null);
    }

    public ValidationIssue(String code, String message, Integer stepNumber, String stepText) {
        this.code       = code;
        this.message    = message;
        this.stepNumber = stepNumber;
        this.stepText   = stepText;
    }

    ValidationIssue addSuggestion(String suggestion) {
        suggestions.add(suggestion);
        return this;
    }

    public String       getCode()        { return code; }
    public String       getMessage()     { return message; }
    public Integer      getStepNumber()  { return stepNumber; }
    public String       getStepText()    { return stepText; }
    public List<String> getSuggestions() { return Collections.unmodifiableList(suggestions); }

    @Override
    public String toString() {
        return stepNumber != null
            ? String.format("%s (step %d): %s", code, stepNumber, message)
            : String.format("%s: %s", code, message);
    }
}
