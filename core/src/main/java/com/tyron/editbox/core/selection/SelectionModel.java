package com.tyron.editbox.core.selection;

/**
 * Selection anchors of an edit box.
 *
 * {@code selStart} is the fixed anchor and {@code selEnd} the active one; they are not ordered, a
 * selection grown to the left has {@code selEnd < selStart}. The caret always sits on the active
 * anchor. Callers keep both anchors within {@code [0, length]} of the text they belong to.
 */
public final class SelectionModel {

    private int selStart;
    private int selEnd;

    public int getSelectionStart() {
        return selStart;
    }

    public int getSelectionEnd() {
        return selEnd;
    }

    public int getCaret() {
        return selEnd;
    }

    public int getLow() {
        return Math.min(selStart, selEnd);
    }

    public int getHigh() {
        return Math.max(selStart, selEnd);
    }

    public int getSelectedCount() {
        return getHigh() - getLow();
    }

    public boolean hasSelection() {
        return selStart != selEnd;
    }

    public void set(int start, int end) {
        if (start < 0 || end < 0) {
            throw new IllegalArgumentException("negative selection anchor: [" + start + ", " + end + "]");
        }
        this.selStart = start;
        this.selEnd = end;
    }

    public void collapseTo(int index) {
        set(index, index);
    }

    /**
     * Moves the active anchor (and with it the caret) while the fixed anchor stays where it is.
     */
    public void moveActiveEnd(int index) {
        set(selStart, index);
    }

    public void clampTo(int length) {
        set(Math.min(selStart, length), Math.min(selEnd, length));
    }

    @Override
    public String toString() {
        return "SelectionModel{start=" + selStart + ", end=" + selEnd + "}";
    }
}
