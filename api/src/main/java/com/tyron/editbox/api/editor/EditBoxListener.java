package com.tyron.editbox.api.editor;

/**
 * Listener for committed {@link EditBox} changes.
 *
 * Callbacks only fire after a change has been committed; a rejected edit never reaches a listener.
 * When one edit changes both the text and the caret, {@link #textChanged(String)} fires first.
 */
public interface EditBoxListener {

    default void textChanged(String newText) {
    }

    default void caretPositionChanged(int caretPosition) {
    }

    /**
     * The return key was pressed.
     */
    default void returnKeyPressed(String text) {
    }

    /**
     * The return key was pressed or the edit box lost focus.
     */
    default void returnOrUnfocused(String text) {
    }
}
