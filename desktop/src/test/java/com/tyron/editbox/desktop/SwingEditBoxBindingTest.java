package com.tyron.editbox.desktop;

import com.tyron.editbox.core.session.EditBoxInputHandler;
import com.tyron.editbox.core.session.EditSession;
import com.tyron.editbox.testFramework.FixedWidthTextMetrics;
import com.tyron.editbox.testFramework.InMemoryClipboard;
import com.tyron.editbox.testFramework.ManualClock;
import com.tyron.editbox.testFramework.RecordingEditBoxListener;
import com.tyron.editbox.testFramework.TestLogging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.swing.JPanel;
import javax.swing.border.EmptyBorder;
import java.awt.event.FocusEvent;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.awt.event.MouseEvent;
import java.util.Arrays;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class SwingEditBoxBindingTest {

    private JPanel component;
    private EditSession session;
    private RecordingEditBoxListener listener;
    private SwingEditBoxBinding binding;

    @BeforeEach
    public void setUp() {
        TestLogging.configureOnce();
        component = new JPanel();
        component.setBorder(new EmptyBorder(0, 4, 0, 0));

        session = new EditSession(new FixedWidthTextMetrics(), new InMemoryClipboard());
        session.setViewportWidth(200);
        listener = new RecordingEditBoxListener();
        session.addListener(listener);
        binding = SwingEditBoxBinding.install(component, new EditBoxInputHandler(session, new ManualClock()));
    }

    private KeyEvent pressed(int keyCode, int modifiersEx) {
        return new KeyEvent(component, KeyEvent.KEY_PRESSED, 0L, modifiersEx, keyCode, KeyEvent.CHAR_UNDEFINED);
    }

    private KeyEvent typed(char c) {
        return new KeyEvent(component, KeyEvent.KEY_TYPED, 0L, 0, KeyEvent.VK_UNDEFINED, c);
    }

    private MouseEvent mouse(int id, int x) {
        return new MouseEvent(component, id, 0L, InputEvent.BUTTON1_DOWN_MASK, x, 5, 1, false, MouseEvent.BUTTON1);
    }

    @Test
    public void typedCharactersAreInserted() {
        KeyEvent a = typed('a');
        binding.keyTyped(a);
        binding.keyTyped(typed('b'));

        assertEquals("ab", session.getText());
        assertTrue(a.isConsumed());
    }

    @Test
    public void surrogatePairsAreJoinedIntoOneCodePoint() {
        String emoji = new String(Character.toChars(0x1F600));

        binding.keyTyped(typed('a'));
        binding.keyTyped(typed(emoji.charAt(0)));
        assertEquals("a", session.getText());
        binding.keyTyped(typed(emoji.charAt(1)));

        assertEquals("a" + emoji, session.getText());
        assertEquals(2, session.getTextLength());
        assertEquals(2, session.getCaretPosition());
    }

    @Test
    public void strayLowSurrogateIsDropped() {
        binding.keyTyped(typed('\uDE00'));
        binding.keyTyped(typed('b'));

        assertEquals("b", session.getText());
    }

    @Test
    public void handledKeysAreConsumed() {
        session.setText("abc");

        KeyEvent backspace = pressed(KeyEvent.VK_BACK_SPACE, 0);
        binding.keyPressed(backspace);
        KeyEvent f1 = pressed(KeyEvent.VK_F1, 0);
        binding.keyPressed(f1);

        assertEquals("ab", session.getText());
        assertTrue(backspace.isConsumed());
        assertFalse(f1.isConsumed());
    }

    @Test
    public void mousePositionIsRelativeToInsets() {
        session.setText("hello");

        binding.mousePressed(mouse(MouseEvent.MOUSE_PRESSED, 19));
        binding.mouseDragged(mouse(MouseEvent.MOUSE_DRAGGED, 38));
        binding.mouseReleased(mouse(MouseEvent.MOUSE_RELEASED, 38));

        assertEquals(1, session.getSelectionStart());
        assertEquals(3, session.getSelectionEnd());
        assertFalse(binding.getHandler().isDragging());
    }

    @Test
    public void focusLossFiresReturnOrUnfocus() {
        session.setText("abc");
        listener.clear();

        binding.focusGained(new FocusEvent(component, FocusEvent.FOCUS_GAINED));
        binding.focusLost(new FocusEvent(component, FocusEvent.FOCUS_LOST, true));
        assertThat(listener.getEvents()).isEmpty();

        binding.focusLost(new FocusEvent(component, FocusEvent.FOCUS_LOST));
        assertThat(listener.getEvents()).containsExactly("returnOrUnfocus:abc");
    }

    @Test
    public void uninstallRemovesListeners() {
        binding.uninstall();

        assertThat(Arrays.asList(component.getKeyListeners())).doesNotContain(binding);
        assertThat(Arrays.asList(component.getMouseListeners())).doesNotContain(binding);
        assertThat(Arrays.asList(component.getFocusListeners())).doesNotContain(binding);
    }
}
