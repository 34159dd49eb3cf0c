package com.tyron.editbox.core.display;

import com.tyron.editbox.api.editor.Alignment;

/**
 * Horizontal scroll state of the edit box.
 *
 * When the text width is not limited the text may be wider than the visible area. The crop position
 * is the index of the first visible code point; it only moves as far as needed to keep the caret visible.
 */
public final class ScrollWindow {

    private int cropPosition;

    public int getCropPosition() {
        return cropPosition;
    }

    public void reset() {
        cropPosition = 0;
    }

    /**
     * Adjusts the crop position after the text or the caret changed.
     */
    public void update(DisplayProjector projection, int caret, float visibleWidth, boolean limitWidth) {
        int length = projection.length();
        if (limitWidth || projection.getTotalWidth() <= visibleWidth) {
            cropPosition = 0;
            return;
        }

        int crop = Math.min(cropPosition, length);
        if (caret < crop) {
            crop = caret;
        }
        while (crop < caret && projection.widthBetween(crop, caret) > visibleWidth) {
            crop++;
        }
        // Pull text back in when there is free space on the right, e.g. after deleting at the end.
        while (crop > 0 && projection.widthBetween(crop - 1, length) <= visibleWidth) {
            crop--;
        }
        cropPosition = crop;
    }

    /**
     * Finds the caret position closest to {@code x}, a pixel offset relative to the left edge of the
     * visible text area. A position is chosen when {@code x} lies before the middle of the character
     * that follows it; a click exactly on the middle of a character goes to the earlier position.
     */
    public int findCaretPosition(float x, DisplayProjector projection, Alignment alignment, float visibleWidth) {
        int length = projection.length();
        int crop = Math.min(cropPosition, length);

        float pos = x - alignmentOffset(projection, alignment, visibleWidth);
        if (pos <= 0) {
            return crop;
        }

        float origin = projection.prefixWidth(crop);
        for (int i = crop; i < length; i++) {
            float left = projection.prefixWidth(i) - origin;
            if (pos <= left + projection.advanceAt(i) / 2f) {
                return i;
            }
        }
        return length;
    }

    /**
     * @return the x position of the caret relative to the left edge of the visible text area.
     */
    public float caretPixelX(int caret, DisplayProjector projection, Alignment alignment, float visibleWidth) {
        int crop = Math.min(cropPosition, projection.length());
        int clamped = Math.max(crop, Math.min(caret, projection.length()));
        return alignmentOffset(projection, alignment, visibleWidth) + projection.widthBetween(crop, clamped);
    }

    private float alignmentOffset(DisplayProjector projection, Alignment alignment, float visibleWidth) {
        if (cropPosition > 0) {
            return 0f;
        }
        float free = visibleWidth - projection.getTotalWidth();
        if (free <= 0) {
            return 0f;
        }
        return switch (alignment) {
            case LEFT -> 0f;
            case CENTER -> free / 2f;
            case RIGHT -> free;
        };
    }
}
