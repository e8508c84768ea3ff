package com.plogic.exception;

/**
 * A character that cannot start or continue any token.
 */
public class UnexpectedCharacterException extends LexicalException {

    private final char character;

    public UnexpectedCharacterException(char character, String input, int position) {
        super("unexpected character '" + character + "'", input, position);
        this.character = character;
    }

    public char getCharacter() {
        return character;
    }
}
