package com.tyron.editbox.api.editor;

import org.jetbrains.annotations.NotNull;

/**
 * Abstract view of a single-line text input.
 *
 * All offsets are code point offsets into {@link #getText()}, not UTF-16 indices.
 */
public interface EditBox {

    @NotNull
    String getText();

    /**
     * Replaces the whole text.
     *
     * The text is cut to the character limit and, when the text width is limited, to the visible width.
     * If what remains does not match the input validator the edit box is cleared instead.
     * The caret moves to the end of the text.
     */
    void setText(@NotNull String text);

    /**
     * @return the text as it is drawn, i.e. masked when a password character is set.
     */
    @NotNull
    String getDisplayedText();

    /**
     * @return the selected part of the unmasked text.
     */
    @NotNull
    String getSelectedText();

    int getCaretPosition();

    void setCaretPosition(int caretPosition);

    /**
     * Selects {@code length} code points starting at {@code start}. Both are clamped to the text.
     */
    void selectText(int start, int length);

    default void selectAll() {
        selectText(0, Integer.MAX_VALUE);
    }

    EditResult insertCharacter(int codePoint);

    EditResult deleteSelectedCharacters();

    EditResult backspace();

    EditResult deleteForward();

    void moveCaretLeft(boolean extendSelection);

    void moveCaretRight(boolean extendSelection);

    void moveCaretWordBegin(boolean extendSelection);

    void moveCaretWordEnd(boolean extendSelection);

    void copy();

    EditResult cut();

    EditResult paste();

    /**
     * Maps a horizontal pixel offset inside the text area to the nearest caret position.
     */
    int findCaretPosition(float x);

    void addListener(EditBoxListener listener);

    void removeListener(EditBoxListener listener);

    /**
     * Monotonically increasing stamp; increments on every committed text change.
     */
    long getModificationStamp();
}
