package com.tyron.editbox.testFramework;

import com.tyron.editbox.api.editor.Clipboard;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * {@link Clipboard} double that keeps its contents in a field.
 *
 * Can be switched into a failing mode where every access throws, like a system clipboard that is
 * owned by another process.
 */
public final class InMemoryClipboard implements Clipboard {

    private String contents;
    private boolean unavailable;

    public InMemoryClipboard() {
    }

    public InMemoryClipboard(String contents) {
        this.contents = contents;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Nullable
    @Override
    public String getContents() {
        if (unavailable) {
            throw new IllegalStateException("clipboard unavailable");
        }
        return contents;
    }

    @Override
    public void setContents(@NotNull String text) {
        if (unavailable) {
            throw new IllegalStateException("clipboard unavailable");
        }
        this.contents = text;
    }

    /**
     * Reads the contents without going through the failure switch.
     */
    @Nullable
    public String peek() {
        return contents;
    }
}
