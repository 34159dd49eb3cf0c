package com.tyron.editbox.api.editor;

import org.jetbrains.annotations.NotNull;

/**
 * Measures rendered text.
 *
 * The edit box never lays out glyphs itself; it only asks for the advance width of a run of
 * displayed text. Implementations must return the same width for the same input as long as the
 * font configuration does not change.
 */
@FunctionalInterface
public interface TextMetrics {

    /**
     * @return the width in pixels that {@code text} takes when drawn on a single line.
     */
    float getTextWidth(@NotNull String text);
}
