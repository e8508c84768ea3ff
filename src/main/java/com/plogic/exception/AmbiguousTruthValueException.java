package com.plogic.exception;

/**
 * Exception thrown when a proposition is used directly as a boolean.
 */
public class AmbiguousTruthValueException extends LogicException {

    public AmbiguousTruthValueException() {
        super("The truth value of a Proposition is ambiguous. Evaluate it under an Interpretation instead");
    }
}
