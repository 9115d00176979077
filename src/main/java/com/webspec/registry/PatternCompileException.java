package com.webspec.registry;

/**
 * Thrown when a step pattern is not a valid regular expression.
 * Raised while the registry is being built, never while matching.
 */
public class PatternCompileException extends RuntimeException {

    private final String pattern;
    private final String identifier;

    public PatternCompileException(String pattern, String identifier, Throwable cause) {
        super("Invalid step pattern for '" + identifier + "': " + pattern
            + (cause != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.pattern    = pattern;
        this.identifier = identifier;
    }

    public String getPattern()    { return pattern; }
    public String getIdentifier() { return identifier; }
}
