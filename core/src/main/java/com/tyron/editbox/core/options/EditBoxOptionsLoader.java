package com.tyron.editbox.core.options;

import com.tyron.editbox.api.editor.Alignment;
import com.tyron.editbox.api.options.EditBoxOptions;
import com.tyron.editbox.api.options.EditBoxOptionsBuilder;
import com.tyron.editbox.core.validation.InvalidPatternException;
import com.tyron.editbox.core.validation.TextValidator;
import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads {@link EditBoxOptions} from YAML.
 *
 * The keys may sit at the document root or below a top-level {@code editBox} mapping:
 * <pre>
 * editBox:
 *   maxChars: 3
 *   validator: uint          # all | int | uint | float, or a regex
 *   passwordChar: "*"
 *   limitWidth: false
 *   alignment: right
 *   readOnly: false
 *   defaultText: "Amount"
 *   suffix: "kg"
 *   viewportWidth: 160
 *   doubleClickMillis: 500
 * </pre>
 * Values are checked while loading, so a loaded instance can always be applied.
 */
public final class EditBoxOptionsLoader {

    private static final Logger LOG = Logger.getLogger(EditBoxOptionsLoader.class.getName());

    static final String ROOT_KEY = "editBox";

    private EditBoxOptionsLoader() {
    }

    public static EditBoxOptions load(@NotNull Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public static EditBoxOptions load(@NotNull InputStream in) {
        Objects.requireNonNull(in, "in");

        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new InvalidOptionsException("Malformed edit box options", e);
        }
        if (doc == null) {
            return EditBoxOptions.empty();
        }
        if (!(doc instanceof Map<?, ?> root)) {
            throw new InvalidOptionsException("Expected a mapping at the document root but got " + doc.getClass().getSimpleName());
        }

        Map<?, ?> map = root;
        Object nested = root.get(ROOT_KEY);
        if (nested instanceof Map<?, ?> nestedMap) {
            map = nestedMap;
        } else if (nested != null) {
            throw new InvalidOptionsException("'" + ROOT_KEY + "' must be a mapping");
        }

        EditBoxOptionsBuilder builder = EditBoxOptions.builder();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            String key = String.valueOf(e.getKey());
            Object value = e.getValue();

            switch (key) {
                case EditBoxOptions.MAX_CHARS -> builder.maxChars(nonNegativeInt(key, value));
                case EditBoxOptions.DOUBLE_CLICK_MILLIS -> builder.doubleClickMillis(nonNegativeInt(key, value));
                case EditBoxOptions.VIEWPORT_WIDTH -> builder.viewportWidth(nonNegativeFloat(key, value));
                case EditBoxOptions.LIMIT_WIDTH, EditBoxOptions.READ_ONLY -> builder.putBoolean(key, bool(key, value));
                case EditBoxOptions.PASSWORD_CHAR -> builder.passwordChar(codePoint(key, value));
                case EditBoxOptions.ALIGNMENT -> builder.alignment(alignment(key, value));
                case EditBoxOptions.VALIDATOR -> builder.validator(validator(key, value));
                case EditBoxOptions.DEFAULT_TEXT, EditBoxOptions.SUFFIX -> builder.put(key, String.valueOf(value));
                default -> {
                    if (LOG.isLoggable(Level.INFO)) {
                        LOG.info("options action=load unknownKey=" + key);
                    }
                }
            }
        }

        EditBoxOptions options = builder.build();
        if (LOG.isLoggable(Level.INFO)) {
            LOG.info("options action=load keys=" + options.asMap().keySet());
        }
        return options;
    }

    private static int nonNegativeInt(String key, Object value) {
        if (value instanceof Number n && n.longValue() >= 0 && n.longValue() <= Integer.MAX_VALUE
                && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.intValue();
        }
        throw invalid(key, value, "a non-negative integer");
    }

    private static float nonNegativeFloat(String key, Object value) {
        if (value instanceof Number n && n.floatValue() >= 0f && Float.isFinite(n.floatValue())) {
            return n.floatValue();
        }
        throw invalid(key, value, "a non-negative number");
    }

    private static boolean bool(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw invalid(key, value, "true or false");
    }

    private static int codePoint(String key, Object value) {
        if (value instanceof String s) {
            if (s.isEmpty()) return 0;
            if (s.codePointCount(0, s.length()) == 1) return s.codePointAt(0);
        } else if (value instanceof Integer i && (i == 0 || Character.isValidCodePoint(i))) {
            return i;
        }
        throw invalid(key, value, "a single character or a code point");
    }

    private static Alignment alignment(String key, Object value) {
        try {
            return Alignment.valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException(message(key, value, "one of left, center, right"), e);
        }
    }

    private static String validator(String key, Object value) {
        String pattern = TextValidator.resolvePattern(String.valueOf(value));
        try {
            TextValidator.compile(pattern);
        } catch (InvalidPatternException e) {
            throw new InvalidOptionsException("Invalid '" + key + "': " + pattern, e);
        }
        return pattern;
    }

    private static InvalidOptionsException invalid(String key, Object value, String expected) {
        return new InvalidOptionsException(message(key, value, expected));
    }

    private static String message(String key, Object value, String expected) {
        return "Invalid '" + key + "': expected " + expected + " but got '" + value + "'";
    }
}
