package com.tyron.editbox.core.display;

import com.tyron.editbox.api.editor.TextMetrics;
import com.tyron.editbox.core.text.TextBuffer;
import it.unimi.dsi.fastutil.floats.FloatArrayList;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Derives the displayed text from the real text and measures it.
 *
 * The displayed text is the real text, or the real text with every code point replaced by the
 * password character. Both always have the same length, so offsets can be shared between them.
 * Widths are measured lazily. After an edit only the prefixes from the first changed code point on
 * are measured again, so typing at the end costs one measurement.
 */
public final class DisplayProjector {

    private final TextMetrics metrics;

    private TextBuffer displayed = TextBuffer.EMPTY;

    /**
     * {@code prefixWidths[i]} is the width of the first {@code i} displayed code points.
     */
    private final FloatArrayList prefixWidths = new FloatArrayList();

    /**
     * Number of leading entries in {@link #prefixWidths} that are still current.
     */
    private int validWidths;

    public DisplayProjector(@NotNull TextMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public static TextBuffer project(TextBuffer text, int passwordChar) {
        return passwordChar == 0 ? text : text.mask(passwordChar);
    }

    public void update(TextBuffer text, int passwordChar) {
        TextBuffer next = project(text, passwordChar);
        validWidths = Math.min(validWidths, displayed.commonPrefixLength(next) + 1);
        displayed = next;
    }

    /**
     * Drops cached widths, e.g. after the font or text size changed.
     */
    public void invalidate() {
        validWidths = 0;
    }

    public TextBuffer getDisplayed() {
        return displayed;
    }

    public String getDisplayedText() {
        return displayed.toString();
    }

    public int length() {
        return displayed.length();
    }

    /**
     * Measures the projection of a text that is not committed yet.
     */
    public float measure(TextBuffer text, int passwordChar) {
        return metrics.getTextWidth(project(text, passwordChar).toString());
    }

    public float measure(String text) {
        return text.isEmpty() ? 0f : metrics.getTextWidth(text);
    }

    public float prefixWidth(int index) {
        ensureWidths();
        return prefixWidths.getFloat(index);
    }

    public float advanceAt(int index) {
        return prefixWidth(index + 1) - prefixWidth(index);
    }

    public float widthBetween(int from, int to) {
        return prefixWidth(to) - prefixWidth(from);
    }

    public float getTotalWidth() {
        return prefixWidth(displayed.length());
    }

    private void ensureWidths() {
        int len = displayed.length();
        if (validWidths == len + 1) {
            return;
        }
        if (validWidths == 0) {
            prefixWidths.clear();
            prefixWidths.add(0f);
            validWidths = 1;
        }
        prefixWidths.size(validWidths);
        prefixWidths.ensureCapacity(len + 1);

        StringBuilder prefix = new StringBuilder(len);
        for (int i = 0; i < len; i++) {
            prefix.appendCodePoint(displayed.codePointAt(i));
            if (i + 1 >= validWidths) {
                prefixWidths.add(metrics.getTextWidth(prefix.toString()));
            }
        }
        validWidths = len + 1;
    }
}
