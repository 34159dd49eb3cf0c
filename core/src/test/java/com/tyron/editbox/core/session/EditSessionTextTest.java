package com.tyron.editbox.core.session;

import com.tyron.editbox.core.BaseEditSessionTest;
import com.tyron.editbox.core.validation.TextValidator;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class EditSessionTextTest extends BaseEditSessionTest {

    @Test
    public void setTextPutsCaretAtEnd() {
        session.setText("abc");

        assertState("abc", 3, 3);
        assertThat(listener.getEvents()).containsExactly("text:abc", "caret:3").inOrder();
    }

    @Test
    public void settingSameTextNotifiesNobody() {
        session.setText("abc");
        listener.clear();

        session.setText("abc");
        assertThat(listener.getEvents()).isEmpty();

        session.setText("abc", 1);
        assertThat(listener.getEvents()).containsExactly("caret:1");
        assertState("abc", 1, 1);
    }

    @Test
    public void caretOverloadClamps() {
        session.setText("abc", 10);
        assertEquals(3, session.getCaretPosition());

        session.setText("abc", -4);
        assertEquals(0, session.getCaretPosition());
    }

    @Test
    public void acceptableTextRoundTrips() {
        session.setMaximumCharacters(20);
        session.setText("hello world");

        assertEquals("hello world", session.getText());
    }

    @Test
    public void setTextTruncatesThenValidates() {
        session.setMaximumCharacters(3);
        session.setInputValidator(TextValidator.UINT);

        session.setText("12345");
        assertEquals("123", session.getText());

        session.setText("12a45");
        assertEquals("", session.getText());
    }

    @Test
    public void mismatchingTextIsCleared() {
        session.setInputValidator(TextValidator.INT);

        session.setText("-12");
        assertEquals("-12", session.getText());

        session.setText("12a");
        assertState("", 0, 0);
    }

    @Test
    public void setTextCutsToVisibleWidth() {
        session.setViewportWidth(50);
        session.limitTextWidth(true);

        session.setText("abcdefgh");

        assertEquals("abcde", session.getText());
    }

    @Test
    public void wideningThePasswordCharacterCutsText() {
        metrics.withAdvance('*', 20f);
        session.setViewportWidth(50);
        session.limitTextWidth(true);
        session.setText("abcd");

        session.setPasswordCharacter('*');

        assertEquals("ab", session.getText());
        assertEquals("**", session.getDisplayedText());
    }

    @Test
    public void loweringMaximumCutsText() {
        session.setText("abcd");

        session.setMaximumCharacters(2);

        assertState("ab", 2, 2);
    }

    @Test
    public void textMetricsChangeCutsLimitedText() {
        session.setViewportWidth(50);
        session.limitTextWidth(true);
        session.setText("abcde");

        metrics.setAdvance(20f);
        session.textMetricsChanged();

        assertEquals("ab", session.getText());
    }

    @Test
    public void newValidatorClearsMismatchingText() {
        session.setText("abc");

        assertTrue(session.setInputValidator("[0-9]*"));
        assertEquals("", session.getText());
    }

    @Test
    public void newValidatorKeepsMatchingText() {
        session.setText("123", 1);

        assertTrue(session.setInputValidator("[0-9]+"));

        assertState("123", 1, 1);
    }

    @Test
    public void invalidValidatorIsRefused() {
        session.setInputValidator("[0-9]+");

        assertFalse(session.setInputValidator("[0-9"));
        assertEquals("[0-9]+", session.getInputValidator());
    }

    @Test
    public void modificationStampCountsTextChanges() {
        assertEquals(0, session.getModificationStamp());

        session.setText("a");
        session.setText("a");
        assertEquals(1, session.getModificationStamp());

        session.insertCharacter('b');
        session.setCaretPosition(0);
        assertEquals(2, session.getModificationStamp());
    }

    @Test
    public void defaultTextShowsOnlyWhileEmpty() {
        session.setDefaultText("Name");
        session.setPasswordCharacter('*');
        assertTrue(session.isShowingDefaultText());
        assertEquals("Name", session.getDefaultText());

        session.setText("x");
        assertFalse(session.isShowingDefaultText());
        assertEquals("*", session.getDisplayedText());
    }

    @Test
    public void rejectsBadPropertyValues() {
        assertThrows(IllegalArgumentException.class, () -> session.setMaximumCharacters(-1));
        assertThrows(IllegalArgumentException.class, () -> session.setPasswordCharacter('\n'));
        assertThrows(IllegalArgumentException.class, () -> session.setViewportWidth(-1f));
        assertThrows(IllegalArgumentException.class, () -> session.setViewportWidth(Float.NaN));
    }
}
