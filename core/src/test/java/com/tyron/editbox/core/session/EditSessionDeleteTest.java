package com.tyron.editbox.core.session;

import com.tyron.editbox.api.editor.EditResult;
import com.tyron.editbox.core.BaseEditSessionTest;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class EditSessionDeleteTest extends BaseEditSessionTest {

    @Test
    public void backspaceRemovesCodePointBeforeCaret() {
        session.setText("abc");
        listener.clear();

        assertEquals(EditResult.APPLIED, session.backspace());

        assertState("ab", 2, 2);
        assertThat(listener.getEvents()).containsExactly("text:ab", "caret:2").inOrder();
    }

    @Test
    public void backspaceAtStartDoesNothing() {
        session.setText("abc", 0);

        assertEquals(EditResult.NO_CHANGE, session.backspace());
        assertState("abc", 0, 0);
    }

    @Test
    public void deleteForwardRemovesCodePointAfterCaret() {
        session.setText("abc", 0);
        listener.clear();

        assertEquals(EditResult.APPLIED, session.deleteForward());

        assertState("bc", 0, 0);
        assertThat(listener.getEvents()).containsExactly("text:bc");
    }

    @Test
    public void deleteForwardAtEndDoesNothing() {
        session.setText("abc");

        assertEquals(EditResult.NO_CHANGE, session.deleteForward());
        assertEquals("abc", session.getText());
    }

    @Test
    public void backspaceRemovesWholeSurrogatePair() {
        session.setText("a😀b", 2);

        session.backspace();

        assertState("ab", 1, 1);
    }

    @Test
    public void deletingSelectionIsIdempotent() {
        session.setText("hello");
        session.selectText(1, 2);

        assertEquals(EditResult.APPLIED, session.deleteSelectedCharacters());
        assertState("hlo", 1, 1);
        long stamp = session.getModificationStamp();

        assertEquals(EditResult.NO_CHANGE, session.deleteSelectedCharacters());
        assertState("hlo", 1, 1);
        assertEquals(stamp, session.getModificationStamp());
    }

    @Test
    public void backspaceWithSelectionOnlyRemovesSelection() {
        session.setText("hello");
        session.selectText(1, 3);

        session.backspace();

        assertState("ho", 1, 1);
    }

    @Test
    public void deleteForwardWithSelectionOnlyRemovesSelection() {
        session.setText("hello", 4);
        session.moveCaretLeft(true);

        session.deleteForward();

        assertState("helo", 3, 3);
    }

    @Test
    public void deletionIsCommittedEvenIfResultFailsValidator() {
        session.setInputValidator("[a-z]+");
        session.setText("ab");
        session.selectAll();

        assertEquals(EditResult.APPLIED, session.deleteSelectedCharacters());

        assertEquals("", session.getText());
    }

    @Test
    public void readOnlyBlocksDeletion() {
        session.setText("abc");
        session.setReadOnly(true);

        assertEquals(EditResult.READ_ONLY, session.backspace());
        assertEquals(EditResult.READ_ONLY, session.deleteForward());
        session.selectAll();
        assertEquals(EditResult.READ_ONLY, session.deleteSelectedCharacters());
        assertEquals("abc", session.getText());
    }
}
