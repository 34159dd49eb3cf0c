package com.tyron.editbox.api.input;

/**
 * Keys an edit box reacts to. Everything else is reported as {@link #OTHER}.
 */
public enum Key {
    LEFT,
    RIGHT,
    HOME,
    END,
    BACKSPACE,
    DELETE,
    ENTER,
    A,
    C,
    X,
    V,
    OTHER
}
