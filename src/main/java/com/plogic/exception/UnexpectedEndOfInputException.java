package com.plogic.exception;

/**
 * Input ended in the middle of a multi-character operator.
 */
public class UnexpectedEndOfInputException extends LexicalException {

    public UnexpectedEndOfInputException(String input, int position) {
        super("unexpected end of input", input, position);
    }
}
