package com.tyron.editbox.api.editor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Access to the host clipboard.
 *
 * Both operations may fail. Callers treat a failure or a {@code null} result as an empty
 * clipboard, never as an error of the edit.
 */
public interface Clipboard {

    /**
     * @return the current clipboard text, or {@code null} when the clipboard is empty or holds no text.
     */
    @Nullable
    String getContents();

    void setContents(@NotNull String text);
}
