package com.tyron.editbox.core.session;

import com.tyron.editbox.api.editor.EditResult;
import com.tyron.editbox.core.BaseEditSessionTest;
import com.tyron.editbox.core.validation.TextValidator;
import com.tyron.editbox.testFramework.TestLogging;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class EditSessionClipboardTest extends BaseEditSessionTest {

    @Test
    public void copyPutsSelectionOnClipboard() {
        session.setText("hello");
        session.selectText(1, 3);

        session.copy();

        assertEquals("ell", clipboard.peek());
        assertState("hello", 1, 4);
    }

    @Test
    public void copyWithoutSelectionKeepsClipboard() {
        clipboard.setContents("old");
        session.setText("hello");

        session.copy();

        assertEquals("old", clipboard.peek());
    }

    @Test
    public void copyIgnoresPasswordMask() {
        session.setPasswordCharacter('*');
        session.setText("secret");
        session.selectText(0, 3);

        session.copy();

        assertEquals("sec", clipboard.peek());
    }

    @Test
    public void cutRemovesSelection() {
        session.setText("hello");
        session.selectText(0, 2);

        assertEquals(EditResult.APPLIED, session.cut());

        assertEquals("he", clipboard.peek());
        assertState("llo", 0, 0);
    }

    @Test
    public void readOnlyCutStillCopies() {
        session.setText("hello");
        session.setReadOnly(true);
        session.selectAll();

        assertEquals(EditResult.READ_ONLY, session.cut());
        assertEquals(EditResult.READ_ONLY, session.paste());

        assertEquals("hello", clipboard.peek());
        assertEquals("hello", session.getText());
    }

    @Test
    public void pasteReplacesSelection() {
        clipboard.setContents("EY");
        session.setText("hello");
        session.selectText(1, 3);

        assertEquals(EditResult.APPLIED, session.paste());

        assertState("hEYo", 3, 3);
    }

    @Test
    public void pasteInsertsAtCaret() {
        clipboard.setContents("bc");
        session.setText("ad", 1);
        listener.clear();

        session.paste();

        assertState("abcd", 3, 3);
        assertThat(listener.getEvents()).containsExactly("text:abcd", "caret:3").inOrder();
    }

    @Test
    public void pasteIsCutToRemainingCharacters() {
        clipboard.setContents("12345");
        session.setInputValidator(TextValidator.UINT);
        session.setMaximumCharacters(4);
        session.setText("9");

        assertEquals(EditResult.APPLIED, session.paste());

        assertState("9123", 4, 4);
    }

    @Test
    public void pasteIntoFullTextIsRejected() {
        clipboard.setContents("x");
        session.setMaximumCharacters(3);
        session.setText("abc");

        assertEquals(EditResult.REJECTED_LENGTH, session.paste());
        assertEquals("abc", session.getText());

        session.selectAll();
        clipboard.setContents("wxyz");
        assertEquals(EditResult.APPLIED, session.paste());
        assertEquals("wxy", session.getText());
    }

    @Test
    public void pasteFailingValidatorIsDroppedWhole() {
        clipboard.setContents("12a");
        session.setInputValidator(TextValidator.UINT);
        session.setText("9");
        listener.clear();

        assertEquals(EditResult.REJECTED_PATTERN, session.paste());

        assertState("9", 1, 1);
        assertThat(listener.getEvents()).isEmpty();
    }

    @Test
    public void pasteIsCutToVisibleWidth() {
        clipboard.setContents("cdefg");
        session.setViewportWidth(50);
        session.limitTextWidth(true);
        session.setText("ab");

        assertEquals(EditResult.APPLIED, session.paste());
        assertState("abcde", 5, 5);

        clipboard.setContents("x");
        assertEquals(EditResult.REJECTED_WIDTH, session.paste());
    }

    @Test
    public void pastedLineBreaksBecomeSpaces() {
        clipboard.setContents("a\r\nb\nc");

        session.paste();

        assertEquals("a b c", session.getText());
    }

    @Test
    public void pastedControlCharactersFollowTypingRules() {
        assertEquals(EditResult.NO_CHANGE, session.insertCharacter('\t'));
        clipboard.setContents("a\tb\u0000c\u001B");

        assertEquals(EditResult.APPLIED, session.paste());

        assertState("a bc", 4, 4);
    }

    @Test
    public void controlOnlyClipboardDoesNothing() {
        session.setText("abc");
        clipboard.setContents("\u0000\u0007");

        assertEquals(EditResult.NO_CHANGE, session.paste());
        assertEquals("abc", session.getText());
    }

    @Test
    public void controlCharactersDoNotCountAgainstLimit() {
        session.setMaximumCharacters(3);
        clipboard.setContents("\u0000a\u0000b\u0000c");

        session.paste();

        assertEquals("abc", session.getText());
    }

    @Test
    public void emptyClipboardDoesNothing() {
        session.setText("abc");

        assertEquals(EditResult.NO_CHANGE, session.paste());
        clipboard.setContents("");
        assertEquals(EditResult.NO_CHANGE, session.paste());
    }

    @Test
    public void unavailableClipboardIsLoggedNotThrown() {
        session.setText("abc");
        session.selectAll();
        clipboard.setUnavailable(true);

        try (TestLogging.CapturedLogs logs = TestLogging.capture(EditSession.class)) {
            assertEquals(EditResult.NO_CHANGE, session.paste());
            session.copy();

            assertTrue(logs.contains(Level.WARNING, "clipboard action=read"));
            assertTrue(logs.contains(Level.WARNING, "clipboard action=write"));
        }
        assertEquals("abc", session.getText());
    }
}
