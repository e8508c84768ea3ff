package com.plogic.exception;

/**
 * Exception thrown when a value of the wrong type is supplied where no coercion is allowed.
 */
public class TypeMismatchException extends LogicException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
