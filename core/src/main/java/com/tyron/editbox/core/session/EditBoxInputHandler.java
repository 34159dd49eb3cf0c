package com.tyron.editbox.core.session;

import com.tyron.editbox.api.input.Key;
import com.tyron.editbox.api.input.KeyStroke;
import com.tyron.editbox.api.options.EditBoxOptions;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates raw keyboard and mouse input into {@link EditSession} intents.
 *
 * Keeps the little state that only matters between events: focus, whether the mouse is dragging a
 * selection, and when the last click happened (a second click within the double-click interval
 * selects all text).
 */
public final class EditBoxInputHandler {

    private static final Logger LOG = Logger.getLogger(EditBoxInputHandler.class.getName());

    public static final Duration DEFAULT_DOUBLE_CLICK_INTERVAL = Duration.ofMillis(500);

    private final EditSession session;
    private final Clock clock;

    private Duration doubleClickInterval = DEFAULT_DOUBLE_CLICK_INTERVAL;
    private boolean focused;
    private boolean dragging;
    private Instant lastPress;

    public EditBoxInputHandler(@NotNull EditSession session) {
        this(session, Clock.systemUTC());
    }

    public EditBoxInputHandler(@NotNull EditSession session, @NotNull Clock clock) {
        this.session = Objects.requireNonNull(session, "session");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EditSession getSession() {
        return session;
    }

    public Duration getDoubleClickInterval() {
        return doubleClickInterval;
    }

    public void setDoubleClickInterval(@NotNull Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("negative double click interval: " + interval);
        }
        this.doubleClickInterval = interval;
    }

    public void applyOptions(@NotNull EditBoxOptions options) {
        session.applyOptions(options);
        if (options.has(EditBoxOptions.DOUBLE_CLICK_MILLIS)) {
            setDoubleClickInterval(Duration.ofMillis(options.getLong(EditBoxOptions.DOUBLE_CLICK_MILLIS, doubleClickInterval.toMillis())));
        }
    }

    // =========================================================================
    // Keyboard
    // =========================================================================

    /**
     * @return true if {@link #keyPressed(KeyStroke)} would do something with this key.
     */
    public boolean canHandleKeyPress(@NotNull KeyStroke stroke) {
        return switch (stroke.key()) {
            case LEFT, RIGHT, HOME, END, BACKSPACE, DELETE, ENTER -> true;
            case A, C, X, V -> stroke.shortcut();
            case OTHER -> false;
        };
    }

    /**
     * @return true if the key was consumed.
     */
    public boolean keyPressed(@NotNull KeyStroke stroke) {
        Objects.requireNonNull(stroke, "stroke");
        if (!session.isEnabled()) {
            return false;
        }

        Key key = stroke.key();
        switch (key) {
            case LEFT -> {
                if (stroke.word()) {
                    session.moveCaretWordBegin(stroke.shift());
                } else {
                    session.moveCaretLeft(stroke.shift());
                }
            }
            case RIGHT -> {
                if (stroke.word()) {
                    session.moveCaretWordEnd(stroke.shift());
                } else {
                    session.moveCaretRight(stroke.shift());
                }
            }
            case HOME -> session.moveCaretToStart(stroke.shift());
            case END -> session.moveCaretToEnd(stroke.shift());
            case BACKSPACE -> session.backspace();
            case DELETE -> session.deleteForward();
            case ENTER -> session.fireReturnKeyPressed();
            case A, C, X, V -> {
                if (!stroke.shortcut()) {
                    return false;
                }
                handleShortcut(key);
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    private void handleShortcut(Key key) {
        switch (key) {
            case A -> session.selectAll();
            case C -> session.copy();
            case X -> session.cut();
            case V -> session.paste();
            default -> throw new IllegalArgumentException("Not a shortcut key: " + key);
        }
    }

    /**
     * Handles a typed character.
     *
     * @return true if the character ended up in the text.
     */
    public boolean textEntered(int codePoint) {
        if (!session.isEnabled()) {
            return false;
        }
        return session.insertCharacter(codePoint).isApplied();
    }

    // =========================================================================
    // Mouse
    // =========================================================================

    /**
     * @param x               pixel offset relative to the left edge of the text area
     * @param extendSelection keep the selection anchor (shift-click)
     */
    public void leftMousePressed(float x, boolean extendSelection) {
        if (!session.isEnabled()) {
            return;
        }
        focused = true;

        Instant now = clock.instant();
        if (!extendSelection && lastPress != null
                && Duration.between(lastPress, now).compareTo(doubleClickInterval) <= 0) {
            lastPress = null;
            dragging = false;
            session.selectAll();
            return;
        }
        lastPress = now;

        session.moveCaretTo(session.findCaretPosition(x), extendSelection);
        dragging = true;
    }

    /**
     * While the button is held, moves the active end of the selection under the mouse. Dragging past
     * the left edge scrolls one character at a time.
     */
    public void mouseMoved(float x) {
        if (!dragging || !session.isEnabled()) {
            return;
        }
        int target;
        if (x < 0 && session.getCropPosition() > 0) {
            target = session.getCropPosition() - 1;
        } else {
            target = session.findCaretPosition(x);
        }
        session.moveCaretTo(target, true);
    }

    public void leftMouseReleased() {
        dragging = false;
    }

    public boolean isDragging() {
        return dragging;
    }

    // =========================================================================
    // Focus
    // =========================================================================

    public boolean isFocused() {
        return focused;
    }

    public void setFocused(boolean focused) {
        if (this.focused == focused) {
            return;
        }
        this.focused = focused;
        if (!focused) {
            dragging = false;
            lastPress = null;
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("focus action=lost textLength=" + session.getTextLength());
            }
            session.fireReturnOrUnfocused();
        }
    }
}
