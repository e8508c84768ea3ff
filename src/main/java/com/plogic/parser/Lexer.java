package com.plogic.parser;

import com.plogic.exception.UnexpectedCharacterException;
import com.plogic.exception.UnexpectedEndOfInputException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static com.plogic.parser.SyntaxConfig.*;

/**
 * Lexer for propositions.
 * Produces tokens lazily, one per {@link #next()} call; a lexer is single-pass, so
 * re-lexing means creating a new one over the same text.
 * <p>
 * Errors are raised when the offending token is reached, not up front. The comma is a
 * token only when separators are enabled; otherwise it is an unexpected character.
 */
public final class Lexer implements Iterator<Token> {

    private final String input;
    private final int length;
    private final boolean separators;
    private int pos;

    public Lexer(String input) {
        this(input, false);
    }

    /**
     * @param input      Text to lex
     * @param separators Whether {@code ,} is lexed as {@link TokenType#COMMA}
     */
    public Lexer(String input, boolean separators) {
        this.input = input;
        this.length = input.length();
        this.separators = separators;
        this.pos = 0;
    }

    /**
     * Lex the whole input eagerly.
     *
     * @param input Text to lex
     * @return List of tokens, without an end marker
     */
    public static List<Token> tokenize(String input) {
        return tokenize(input, false);
    }

    public static List<Token> tokenize(String input, boolean separators) {
        List<Token> tokens = new ArrayList<>();
        new Lexer(input, separators).forEachRemaining(tokens::add);
        return tokens;
    }

    @Override
    public boolean hasNext() {
        skipWhitespace();
        return !isAtEnd();
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens in '" + input + "'");
        }

        int start = pos;
        char c = advance();

        return switch (c) {
            case Operators.TILDE -> new Token(TokenType.NOT, "~", start);
            case Operators.AMPERSAND -> new Token(TokenType.AND, "&", start);
            case Operators.PIPE -> new Token(TokenType.OR, "|", start);
            case Operators.LEFT_PAREN -> new Token(TokenType.LPAREN, "(", start);
            case Operators.RIGHT_PAREN -> new Token(TokenType.RPAREN, ")", start);
            case Operators.COMMA -> {
                if (!separators) {
                    throw new UnexpectedCharacterException(c, input, start);
                }
                yield new Token(TokenType.COMMA, ",", start);
            }
            case Operators.MINUS -> {
                accept(Operators.GREATER);
                yield new Token(TokenType.IMPLIES, IMPLIES, start);
            }
            case Operators.LESS -> {
                accept(Operators.MINUS);
                accept(Operators.GREATER);
                yield new Token(TokenType.IFF, IFF, start);
            }
            default -> {
                if (isIdentifierStart(c)) {
                    yield readIdentifier(start);
                }
                throw new UnexpectedCharacterException(c, input, start);
            }
        };
    }

    private Token readIdentifier(int start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        return new Token(TokenType.IDENT, input.substring(start, pos), start);
    }

    /**
     * Consume the next character, which must be {@code expected}.
     */
    private void accept(char expected) {
        if (isAtEnd()) {
            throw new UnexpectedEndOfInputException(input, pos);
        }
        char c = peek();
        if (c != expected) {
            throw new UnexpectedCharacterException(c, input, pos);
        }
        advance();
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) {
            advance();
        }
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
