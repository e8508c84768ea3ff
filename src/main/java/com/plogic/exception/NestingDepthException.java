package com.plogic.exception;

/**
 * Exception thrown when a formula nests deeper than can be processed.
 */
public class NestingDepthException extends LogicException {

    public NestingDepthException(String message) {
        super(message);
    }

    public NestingDepthException(String message, Throwable cause) {
        super(message, cause);
    }
}
