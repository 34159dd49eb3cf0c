package com.tyron.editbox.core.options;

/**
 * Thrown when edit box options cannot be read or applied.
 */
public class InvalidOptionsException extends RuntimeException {

    public InvalidOptionsException(String message) {
        super(message);
    }

    public InvalidOptionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
