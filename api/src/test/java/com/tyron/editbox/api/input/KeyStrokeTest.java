package com.tyron.editbox.api.input;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class KeyStrokeTest {

    @Test
    public void factoriesSetModifiers() {
        assertEquals(new KeyStroke(Key.LEFT, true, false, false), KeyStroke.shift(Key.LEFT));
        assertEquals(new KeyStroke(Key.V, false, true, false), KeyStroke.shortcut(Key.V));
        assertEquals(new KeyStroke(Key.RIGHT, true, false, true), KeyStroke.word(Key.RIGHT, true));
        assertFalse(KeyStroke.of(Key.ENTER).shift());
    }

    @Test
    public void keyIsRequired() {
        assertThrows(NullPointerException.class, () -> KeyStroke.of(null));
    }
}
