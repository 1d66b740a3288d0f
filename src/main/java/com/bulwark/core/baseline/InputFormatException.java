package com.bulwark.core.baseline;

/**
 * Thrown when a baseline document is not valid JSON or has neither a
 * {@code scores} object nor a {@code checks} array.
 */
public class InputFormatException extends RuntimeException {
    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
