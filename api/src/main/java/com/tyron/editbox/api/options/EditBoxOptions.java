package com.tyron.editbox.api.options;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable edit box configuration.
 * <p>
 * Only keys that are present are applied; a missing key leaves the corresponding property alone.
 */
public final class EditBoxOptions {

    public static final String MAX_CHARS = "maxChars";
    public static final String VALIDATOR = "validator";
    public static final String PASSWORD_CHAR = "passwordChar";
    public static final String LIMIT_WIDTH = "limitWidth";
    public static final String ALIGNMENT = "alignment";
    public static final String READ_ONLY = "readOnly";
    public static final String DEFAULT_TEXT = "defaultText";
    public static final String SUFFIX = "suffix";
    public static final String VIEWPORT_WIDTH = "viewportWidth";
    public static final String DOUBLE_CLICK_MILLIS = "doubleClickMillis";

    private static final EditBoxOptions EMPTY = new EditBoxOptions(Map.of());

    public static EditBoxOptions empty() {
        return EMPTY;
    }

    public static EditBoxOptionsBuilder builder() {
        return new EditBoxOptionsBuilder();
    }

    private final Map<String, String> values;

    EditBoxOptions(Map<String, String> values) {
        this.values = Map.copyOf(Objects.requireNonNull(values, "values"));
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public String get(String key) {
        return values.get(key);
    }

    public String get(String key, String defaultValue) {
        String v = values.get(key);
        return v != null ? v : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String v = values.get(key);
        if (v == null) return defaultValue;
        return Boolean.parseBoolean(v);
    }

    public int getInt(String key, int defaultValue) {
        String v = values.get(key);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String v = values.get(key);
        if (v == null) return defaultValue;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public float getFloat(String key, float defaultValue) {
        String v = values.get(key);
        if (v == null) return defaultValue;
        try {
            return Float.parseFloat(v.trim());
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * The password character is stored as the character itself; an empty value disables masking.
     *
     * @return the first code point of the value, or {@code 0} for none.
     */
    public int getCodePoint(String key, int defaultValue) {
        String v = values.get(key);
        if (v == null) return defaultValue;
        if (v.isEmpty()) return 0;
        return v.codePointAt(0);
    }

    @Override
    public String toString() {
        return "EditBoxOptions" + values;
    }
}
