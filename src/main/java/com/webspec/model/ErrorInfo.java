package com.webspec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Structured error attached to a failed step.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorInfo {

    public static final String UNMATCHED_STEP        = "UNMATCHED_STEP";
    public static final String STEP_EXECUTION_FAILED = "STEP_EXECUTION_FAILED";

    private final String       code;
    private final String       message;
    private final List<String> suggestions;

    @JsonCreator
    public ErrorInfo(@JsonProperty("code") String code,
                     @JsonProperty("message") String message,
                     @JsonProperty("suggestions") List<String> suggestions) {
        this.code        = code;
        this.message     = message;
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : Collections.emptyList();
    }

    public ErrorInfo(String code, String message) {
        this(code, message, null);
    }

    public String       getCode()        { return code; }
    public String       getMessage()     { return message; }
    public List<String> getSuggestions() { return suggestions; }

    @Override
    public String toString() {
        return String.format("ErrorInfo{code=%s, message='%s'}", code, message);
    }
}
