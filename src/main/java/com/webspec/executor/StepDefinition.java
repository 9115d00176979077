package com.webspec.executor;

/** One parsed step line: keyword (Given/When/Then/And/But) and text. */
public record StepDefinition(String keyword, String text) {

    public static StepDefinition of(String keyword, String text) {
        return new StepDefinition(keyword, text);
    }
}
