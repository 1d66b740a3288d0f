package com.bulwark.core.check;

/**
 * Thrown when a check cannot complete its evaluation, for example because a
 * manifest it must parse is malformed.
 */
public class CheckExecutionException extends RuntimeException {
    public CheckExecutionException(String message) {
        super(message);
    }

    public CheckExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
