package com.tyron.editbox.core.validation;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled input validator.
 *
 * A candidate text is accepted only when the whole of it matches the pattern. Patterns are compiled
 * with {@link Pattern#DOTALL}, so {@code .*} accepts every string including the empty one.
 * Instances are immutable; changing the validator means compiling a new one.
 */
public final class TextValidator {

    /**
     * Accept any input.
     */
    public static final String ALL = ".*";

    /**
     * Accept negative and positive integers.
     */
    public static final String INT = "[+-]?[0-9]*";

    /**
     * Accept only positive integers.
     */
    public static final String UINT = "[0-9]*";

    /**
     * Accept decimal numbers.
     */
    public static final String FLOAT = "[+-]?[0-9]*\\.?[0-9]*";

    private static final TextValidator ACCEPT_ALL = new TextValidator(ALL, Pattern.compile(ALL, Pattern.DOTALL));

    private final String pattern;
    private final Pattern compiled;

    private TextValidator(String pattern, Pattern compiled) {
        this.pattern = pattern;
        this.compiled = compiled;
    }

    public static TextValidator acceptAll() {
        return ACCEPT_ALL;
    }

    public static TextValidator compile(@NotNull String pattern) throws InvalidPatternException {
        Objects.requireNonNull(pattern, "pattern");
        if (ALL.equals(pattern)) {
            return ACCEPT_ALL;
        }
        try {
            return new TextValidator(pattern, Pattern.compile(pattern, Pattern.DOTALL));
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(pattern, e);
        }
    }

    /**
     * Resolves the names of the predefined validators ({@code all}, {@code int}, {@code uint},
     * {@code float}, case-insensitive). Any other value is returned as is and treated as a regex.
     */
    public static String resolvePattern(@NotNull String nameOrPattern) {
        return switch (nameOrPattern.trim().toLowerCase(Locale.ROOT)) {
            case "all" -> ALL;
            case "int" -> INT;
            case "uint" -> UINT;
            case "float" -> FLOAT;
            default -> nameOrPattern;
        };
    }

    public boolean matches(@NotNull CharSequence candidate) {
        return compiled.matcher(candidate).matches();
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "TextValidator{" + pattern + "}";
    }
}
