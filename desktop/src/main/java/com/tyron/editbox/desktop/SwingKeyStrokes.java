package com.tyron.editbox.desktop;

import com.tyron.editbox.api.input.Key;
import com.tyron.editbox.api.input.KeyStroke;
import org.jetbrains.annotations.NotNull;

import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.util.Locale;

/**
 * Translates AWT key events into {@link KeyStroke}s.
 *
 * On macOS the shortcut modifier is Cmd and the word modifier is Option; elsewhere both are Ctrl.
 */
public final class SwingKeyStrokes {

    private static final boolean MAC = System.getProperty("os.name", "")
            .toLowerCase(Locale.ROOT)
            .startsWith("mac");

    private SwingKeyStrokes() {
    }

    public static KeyStroke fromKeyEvent(@NotNull KeyEvent event) {
        return fromKeyCode(event.getKeyCode(), event.getModifiersEx(), MAC);
    }

    /**
     * @param modifiersEx extended modifiers, see {@link InputEvent#getModifiersEx()}
     */
    public static KeyStroke fromKeyCode(int keyCode, int modifiersEx, boolean mac) {
        boolean shift = (modifiersEx & InputEvent.SHIFT_DOWN_MASK) != 0;
        boolean ctrl = (modifiersEx & InputEvent.CTRL_DOWN_MASK) != 0;
        boolean meta = (modifiersEx & InputEvent.META_DOWN_MASK) != 0;
        boolean alt = (modifiersEx & InputEvent.ALT_DOWN_MASK) != 0;

        boolean shortcut = mac ? meta : ctrl;
        boolean word = mac ? alt : ctrl;
        return new KeyStroke(toKey(keyCode), shift, shortcut, word);
    }

    static Key toKey(int keyCode) {
        return switch (keyCode) {
            case KeyEvent.VK_LEFT, KeyEvent.VK_KP_LEFT -> Key.LEFT;
            case KeyEvent.VK_RIGHT, KeyEvent.VK_KP_RIGHT -> Key.RIGHT;
            case KeyEvent.VK_HOME -> Key.HOME;
            case KeyEvent.VK_END -> Key.END;
            case KeyEvent.VK_BACK_SPACE -> Key.BACKSPACE;
            case KeyEvent.VK_DELETE -> Key.DELETE;
            case KeyEvent.VK_ENTER -> Key.ENTER;
            case KeyEvent.VK_A -> Key.A;
            case KeyEvent.VK_C -> Key.C;
            case KeyEvent.VK_X -> Key.X;
            case KeyEvent.VK_V -> Key.V;
            default -> Key.OTHER;
        };
    }

    /**
     * @return the code point a {@code KEY_TYPED} event carries, or {@code -1} when it carries none
     * or was typed together with the shortcut modifier. Surrogate halves are returned as they are;
     * {@link SwingEditBoxBinding} joins them.
     */
    public static int typedCodePoint(@NotNull KeyEvent event) {
        return typedCodePoint(event.getKeyChar(), event.getModifiersEx(), MAC);
    }

    static int typedCodePoint(char keyChar, int modifiersEx, boolean mac) {
        if (keyChar == KeyEvent.CHAR_UNDEFINED || Character.isISOControl(keyChar)) {
            return -1;
        }
        int shortcutMask = mac ? InputEvent.META_DOWN_MASK : InputEvent.CTRL_DOWN_MASK;
        if ((modifiersEx & shortcutMask) != 0) {
            return -1;
        }
        return keyChar;
    }
}
