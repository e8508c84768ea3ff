package com.plogic.exception;

/**
 * Exception thrown by the lexer.
 */
public abstract class LexicalException extends PropositionParseException {

    protected LexicalException(String message, String input, int position) {
        super(message, input, position);
    }
}
