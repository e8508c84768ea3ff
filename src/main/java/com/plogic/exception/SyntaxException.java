package com.plogic.exception;

/**
 * Exception thrown when the token sequence does not match the grammar.
 * The lexeme is {@code null} when the input ended early.
 */
public class SyntaxException extends PropositionParseException {

    private final String lexeme;

    public SyntaxException(String message, String lexeme, String input, int position) {
        super(lexeme == null
                ? message + ", reached end of input"
                : message + ", found '" + lexeme + "'", input, position);
        this.lexeme = lexeme;
    }

    public String getLexeme() {
        return lexeme;
    }

    public boolean isEndOfInput() {
        return lexeme == null;
    }
}
