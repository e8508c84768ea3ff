package com.plogic.parser;

/**
 * Characters and operator spellings of the proposition syntax.
 */
public final class SyntaxConfig {

    private SyntaxConfig() {
    }

    /**
     * Operator and separator characters.
     */
    public static final class Operators {
        public static final char TILDE = '~';
        public static final char AMPERSAND = '&';
        public static final char PIPE = '|';
        public static final char MINUS = '-';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char COMMA = ',';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }

    public static final String IMPLIES = "->";
    public static final String IFF = "<->";

    /**
     * Whitespace skipped between tokens: space, tab, form feed, carriage return, newline.
     */
    public static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\r' || c == '\n';
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == Operators.UNDERSCORE;
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
