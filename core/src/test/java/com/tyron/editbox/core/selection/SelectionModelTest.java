package com.tyron.editbox.core.selection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SelectionModelTest {

    @Test
    public void rangeIsNormalizedWhenGrownToTheLeft() {
        SelectionModel selection = new SelectionModel();
        selection.set(5, 2);

        assertEquals(2, selection.getLow());
        assertEquals(5, selection.getHigh());
        assertEquals(3, selection.getSelectedCount());
        assertEquals(2, selection.getCaret());
        assertTrue(selection.hasSelection());
    }

    @Test
    public void movingActiveEndKeepsAnchor() {
        SelectionModel selection = new SelectionModel();
        selection.collapseTo(3);
        selection.moveActiveEnd(1);
        selection.moveActiveEnd(6);

        assertEquals(3, selection.getSelectionStart());
        assertEquals(6, selection.getSelectionEnd());
        assertEquals(6, selection.getCaret());
    }

    @Test
    public void clampShrinksBothAnchors() {
        SelectionModel selection = new SelectionModel();
        selection.set(8, 2);
        selection.clampTo(4);

        assertEquals(4, selection.getSelectionStart());
        assertEquals(2, selection.getSelectionEnd());
    }

    @Test
    public void rejectsNegativeAnchors() {
        assertThrows(IllegalArgumentException.class, () -> new SelectionModel().set(-1, 0));
    }
}
