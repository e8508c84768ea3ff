package com.plogic.parser;

/**
 * Token types for proposition parsing.
 */
public enum TokenType {
    // Identifiers
    IDENT,

    // Connectives
    NOT,
    AND,
    OR,
    IMPLIES,
    IFF,

    // Delimiters
    LPAREN,
    RPAREN,
    COMMA,

    // Special
    EOF
}
