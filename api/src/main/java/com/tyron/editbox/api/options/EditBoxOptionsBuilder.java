package com.tyron.editbox.api.options;

import com.tyron.editbox.api.editor.Alignment;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder for {@link EditBoxOptions}.
 */
public final class EditBoxOptionsBuilder {

    private final Map<String, String> values = new LinkedHashMap<>();

    EditBoxOptionsBuilder() {
    }

    public EditBoxOptionsBuilder put(String key, String value) {
        if (key == null || key.isBlank() || value == null) return this;
        values.put(key, value);
        return this;
    }

    public EditBoxOptionsBuilder putBoolean(String key, boolean value) {
        return put(key, Boolean.toString(value));
    }

    public EditBoxOptionsBuilder putInt(String key, int value) {
        return put(key, Integer.toString(value));
    }

    public EditBoxOptionsBuilder putLong(String key, long value) {
        return put(key, Long.toString(value));
    }

    public EditBoxOptionsBuilder putFloat(String key, float value) {
        return put(key, Float.toString(value));
    }

    public EditBoxOptionsBuilder maxChars(int maxChars) {
        return putInt(EditBoxOptions.MAX_CHARS, maxChars);
    }

    public EditBoxOptionsBuilder validator(String pattern) {
        return put(EditBoxOptions.VALIDATOR, pattern);
    }

    public EditBoxOptionsBuilder passwordChar(int codePoint) {
        return put(EditBoxOptions.PASSWORD_CHAR, codePoint == 0 ? "" : Character.toString(codePoint));
    }

    public EditBoxOptionsBuilder limitWidth(boolean limitWidth) {
        return putBoolean(EditBoxOptions.LIMIT_WIDTH, limitWidth);
    }

    public EditBoxOptionsBuilder alignment(Alignment alignment) {
        return put(EditBoxOptions.ALIGNMENT, alignment.name());
    }

    public EditBoxOptionsBuilder readOnly(boolean readOnly) {
        return putBoolean(EditBoxOptions.READ_ONLY, readOnly);
    }

    public EditBoxOptionsBuilder defaultText(String defaultText) {
        return put(EditBoxOptions.DEFAULT_TEXT, defaultText);
    }

    public EditBoxOptionsBuilder suffix(String suffix) {
        return put(EditBoxOptions.SUFFIX, suffix);
    }

    public EditBoxOptionsBuilder viewportWidth(float width) {
        return putFloat(EditBoxOptions.VIEWPORT_WIDTH, width);
    }

    public EditBoxOptionsBuilder doubleClickMillis(long millis) {
        return putLong(EditBoxOptions.DOUBLE_CLICK_MILLIS, millis);
    }

    public EditBoxOptions build() {
        return new EditBoxOptions(values);
    }
}
