package com.plogic.parser;

/**
 * Represents a token in a proposition.
 *
 * @param type     Token type
 * @param text     Original text
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
