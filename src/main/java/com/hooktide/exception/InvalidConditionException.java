package com.hooktide.exception;

/** A filter expression could not be compiled. Configuration error, not a per-event failure. */
public class InvalidConditionException extends RuntimeException {

    public InvalidConditionException(String message) {
        super(message);
    }

    public InvalidConditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
