package com.plogic.exception;

/**
 * Base exception for the plogic library.
 */
public class LogicException extends RuntimeException {

    public LogicException(String message) {
        super(message);
    }

    public LogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
