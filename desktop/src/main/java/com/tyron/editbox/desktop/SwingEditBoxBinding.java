package com.tyron.editbox.desktop;

import com.tyron.editbox.api.input.KeyStroke;
import com.tyron.editbox.core.session.EditBoxInputHandler;
import org.jetbrains.annotations.NotNull;

import javax.swing.JComponent;
import javax.swing.SwingUtilities;
import java.awt.event.FocusEvent;
import java.awt.event.FocusListener;
import java.awt.event.KeyEvent;
import java.awt.event.KeyListener;
import java.awt.event.MouseEvent;
import java.awt.event.MouseListener;
import java.awt.event.MouseMotionListener;
import java.util.Objects;

/**
 * Forwards the keyboard, mouse and focus events of a Swing component to an {@link EditBoxInputHandler}.
 *
 * Mouse x positions are made relative to the component's left inset, which is where the text starts.
 * The component is repainted after every event that reached the handler.
 */
public final class SwingEditBoxBinding implements KeyListener, MouseListener, MouseMotionListener, FocusListener {

    private final JComponent component;
    private final EditBoxInputHandler handler;

    /**
     * High surrogate of a supplementary character whose low half has not been typed yet, or 0.
     */
    private char pendingHighSurrogate;

    private SwingEditBoxBinding(JComponent component, EditBoxInputHandler handler) {
        this.component = component;
        this.handler = handler;
    }

    public static SwingEditBoxBinding install(@NotNull JComponent component, @NotNull EditBoxInputHandler handler) {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(handler, "handler");

        SwingEditBoxBinding binding = new SwingEditBoxBinding(component, handler);
        component.setFocusable(true);
        component.setFocusTraversalKeysEnabled(false);
        component.addKeyListener(binding);
        component.addMouseListener(binding);
        component.addMouseMotionListener(binding);
        component.addFocusListener(binding);
        return binding;
    }

    public void uninstall() {
        component.removeKeyListener(this);
        component.removeMouseListener(this);
        component.removeMouseMotionListener(this);
        component.removeFocusListener(this);
    }

    public EditBoxInputHandler getHandler() {
        return handler;
    }

    // =========================================================================
    // Keyboard
    // =========================================================================

    @Override
    public void keyPressed(KeyEvent e) {
        KeyStroke stroke = SwingKeyStrokes.fromKeyEvent(e);
        if (handler.canHandleKeyPress(stroke) && handler.keyPressed(stroke)) {
            e.consume();
            component.repaint();
        }
    }

    /**
     * Supplementary characters arrive as two {@code KEY_TYPED} events, one per surrogate; they are
     * joined before reaching the handler.
     */
    @Override
    public void keyTyped(KeyEvent e) {
        int codePoint = SwingKeyStrokes.typedCodePoint(e);
        if (codePoint < 0) {
            pendingHighSurrogate = 0;
            return;
        }
        e.consume();

        char c = (char) codePoint;
        if (Character.isHighSurrogate(c)) {
            pendingHighSurrogate = c;
            return;
        }
        if (Character.isLowSurrogate(c)) {
            if (pendingHighSurrogate == 0) {
                return;
            }
            codePoint = Character.toCodePoint(pendingHighSurrogate, c);
        }
        pendingHighSurrogate = 0;

        if (handler.textEntered(codePoint)) {
            component.repaint();
        }
    }

    @Override
    public void keyReleased(KeyEvent e) {
    }

    // =========================================================================
    // Mouse
    // =========================================================================

    @Override
    public void mousePressed(MouseEvent e) {
        if (!SwingUtilities.isLeftMouseButton(e)) {
            return;
        }
        component.requestFocusInWindow();
        handler.leftMousePressed(textX(e), e.isShiftDown());
        component.repaint();
    }

    @Override
    public void mouseDragged(MouseEvent e) {
        if (!handler.isDragging()) {
            return;
        }
        handler.mouseMoved(textX(e));
        component.repaint();
    }

    @Override
    public void mouseReleased(MouseEvent e) {
        if (SwingUtilities.isLeftMouseButton(e)) {
            handler.leftMouseReleased();
        }
    }

    @Override
    public void mouseClicked(MouseEvent e) {
    }

    @Override
    public void mouseEntered(MouseEvent e) {
    }

    @Override
    public void mouseExited(MouseEvent e) {
    }

    @Override
    public void mouseMoved(MouseEvent e) {
    }

    private float textX(MouseEvent e) {
        return e.getX() - component.getInsets().left;
    }

    // =========================================================================
    // Focus
    // =========================================================================

    @Override
    public void focusGained(FocusEvent e) {
        handler.setFocused(true);
        component.repaint();
    }

    @Override
    public void focusLost(FocusEvent e) {
        if (e.isTemporary()) {
            return;
        }
        handler.setFocused(false);
        component.repaint();
    }
}
