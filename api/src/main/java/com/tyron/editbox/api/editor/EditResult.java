package com.tyron.editbox.api.editor;

/**
 * Outcome of a mutating edit.
 *
 * Anything other than {@link #APPLIED} means the committed state is exactly what it was before the call.
 */
public enum EditResult {
    APPLIED,

    /**
     * The intent had nothing to do (e.g. backspace at offset 0, no selection to delete).
     */
    NO_CHANGE,

    READ_ONLY,

    /**
     * The candidate text was longer than the character limit.
     */
    REJECTED_LENGTH,

    /**
     * The candidate text did not match the input validator.
     */
    REJECTED_PATTERN,

    /**
     * The candidate text did not fit in the visible width while the text width is limited.
     */
    REJECTED_WIDTH;

    public boolean isApplied() {
        return this == APPLIED;
    }

    public boolean isRejected() {
        return this == REJECTED_LENGTH || this == REJECTED_PATTERN || this == REJECTED_WIDTH;
    }
}
