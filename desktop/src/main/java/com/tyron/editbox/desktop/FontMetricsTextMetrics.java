package com.tyron.editbox.desktop;

import com.tyron.editbox.api.editor.TextMetrics;
import org.jetbrains.annotations.NotNull;

import java.awt.FontMetrics;
import java.util.Objects;

/**
 * Measures text with the {@link FontMetrics} of the component that draws the edit box.
 *
 * After a font change, pass the new metrics to {@link #setFontMetrics(FontMetrics)} and call
 * {@code EditSession#textMetricsChanged()}.
 */
public final class FontMetricsTextMetrics implements TextMetrics {

    private FontMetrics fontMetrics;

    public FontMetricsTextMetrics(@NotNull FontMetrics fontMetrics) {
        this.fontMetrics = Objects.requireNonNull(fontMetrics, "fontMetrics");
    }

    public FontMetrics getFontMetrics() {
        return fontMetrics;
    }

    public void setFontMetrics(@NotNull FontMetrics fontMetrics) {
        this.fontMetrics = Objects.requireNonNull(fontMetrics, "fontMetrics");
    }

    @Override
    public float getTextWidth(@NotNull String text) {
        return fontMetrics.stringWidth(text);
    }
}
