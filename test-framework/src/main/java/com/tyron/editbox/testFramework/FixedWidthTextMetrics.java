package com.tyron.editbox.testFramework;

import com.tyron.editbox.api.editor.TextMetrics;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link TextMetrics} double where every code point has a fixed advance.
 *
 * Individual code points can be given their own advance to test proportional fonts.
 * The width of a string is the sum of its advances, so boundary positions are easy to compute by hand.
 */
public final class FixedWidthTextMetrics implements TextMetrics {

    public static final float DEFAULT_ADVANCE = 10f;

    private float advance;
    private final Map<Integer, Float> overrides = new HashMap<>();
    private int measureCount;

    public FixedWidthTextMetrics() {
        this(DEFAULT_ADVANCE);
    }

    public FixedWidthTextMetrics(float advance) {
        this.advance = advance;
    }

    public FixedWidthTextMetrics withAdvance(int codePoint, float width) {
        overrides.put(codePoint, width);
        return this;
    }

    /**
     * Simulates a font size change.
     */
    public void setAdvance(float advance) {
        this.advance = advance;
    }

    public int getMeasureCount() {
        return measureCount;
    }

    @Override
    public float getTextWidth(@NotNull String text) {
        measureCount++;
        float width = 0f;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            width += overrides.getOrDefault(cp, advance);
            i += Character.charCount(cp);
        }
        return width;
    }
}
