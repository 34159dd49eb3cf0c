package com.tyron.editbox.core.validation;

/**
 * Thrown when an input validator pattern cannot be compiled.
 */
public class InvalidPatternException extends Exception {

    private final String pattern;

    public InvalidPatternException(String pattern, Throwable cause) {
        super("Invalid input validator pattern: " + pattern, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
