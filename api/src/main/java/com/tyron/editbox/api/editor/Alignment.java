package com.tyron.editbox.api.editor;

/**
 * Horizontal placement of the text inside the edit box when it is narrower than the visible area.
 */
public enum Alignment {
    LEFT,
    CENTER,
    /**
     * Useful for numbers.
     */
    RIGHT
}
