package com.tyron.editbox.api.input;

import java.util.Objects;

/**
 * A platform independent key press.
 *
 * Platform adapters decide which physical modifier means what: {@code shortcut} is Ctrl on most
 * systems and Cmd on macOS, {@code word} is Ctrl on most systems and Alt on macOS.
 *
 * @param key      the key that was pressed
 * @param shift    extends the selection for caret movement
 * @param shortcut the clipboard / select-all modifier
 * @param word     moves the caret by word instead of by character
 */
public record KeyStroke(Key key, boolean shift, boolean shortcut, boolean word) {

    public KeyStroke {
        Objects.requireNonNull(key, "key");
    }

    public static KeyStroke of(Key key) {
        return new KeyStroke(key, false, false, false);
    }

    public static KeyStroke shift(Key key) {
        return new KeyStroke(key, true, false, false);
    }

    public static KeyStroke shortcut(Key key) {
        return new KeyStroke(key, false, true, false);
    }

    public static KeyStroke word(Key key, boolean shift) {
        return new KeyStroke(key, shift, false, true);
    }
}
