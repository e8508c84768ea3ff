package com.plogic.parser;

import com.plogic.exception.NestingDepthException;
import com.plogic.exception.PropositionParseException;
import com.plogic.exception.SyntaxException;
import com.plogic.proposition.And;
import com.plogic.proposition.Iff;
import com.plogic.proposition.Implies;
import com.plogic.proposition.Not;
import com.plogic.proposition.Or;
import com.plogic.proposition.Predicate;
import com.plogic.proposition.Proposition;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Parser for propositions.
 * Converts tokens into a Proposition tree using recursive descent parsing,
 * with one token of lookahead and no backtracking.
 * <p>
 * Grammar (loosest first):
 * <pre>
 * iff         := implies ('&lt;-&gt;' iff)?
 * implies     := disjunction ('-&gt;' implies)?
 * disjunction := conjunction ('|' conjunction)*
 * conjunction := negation ('&amp;' negation)*
 * negation    := '~' negation | unit
 * unit        := IDENT | '(' iff ')'
 * </pre>
 * {@code &} and {@code |} associate to the left, {@code ->} and {@code <->} to the right.
 * Commas are only lexed by {@link #parseAll()}.
 * <p>
 * Depth limit: the tree being built may be at most {@code maxDepth} connectives tall, and
 * parentheses may nest at most {@code maxDepth} deep. Formatted output of any accepted tree
 * stays within both limits, so it parses back under the same limit.
 * <p>
 * A parser is single use.
 */
public final class PropositionParser {

    public static final int DEFAULT_MAX_DEPTH = 512;

    private final String input;
    private final int maxDepth;
    private Iterator<Token> tokens;
    private Token current;
    private int pending;
    private int parentheses;

    public PropositionParser(String input) {
        this(input, DEFAULT_MAX_DEPTH);
    }

    public PropositionParser(String input, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.input = Objects.requireNonNull(input, "input");
        this.maxDepth = maxDepth;
    }

    /**
     * Parse exactly one proposition; the input must end after it.
     *
     * @return Parsed proposition
     */
    public Proposition parse() {
        start(false);
        Parsed result = parseIff();
        expect(TokenType.EOF, "Expected end of input");
        return result.proposition();
    }

    /**
     * Parse comma-separated propositions. Blank input gives an empty list; an empty
     * segment between or after commas is an error.
     *
     * @return Parsed propositions in input order
     */
    public List<Proposition> parseAll() {
        start(true);
        List<Proposition> result = new ArrayList<>();
        if (check(TokenType.EOF)) {
            return result;
        }

        result.add(parseIff().proposition());
        while (match(TokenType.COMMA)) {
            result.add(parseIff().proposition());
        }

        expect(TokenType.EOF, "Expected ',' or end of input");
        return result;
    }

    private void start(boolean separators) {
        if (tokens != null) {
            throw new IllegalStateException("Parser has already been used for '"
                    + PropositionParseException.excerpt(input, 0) + "'");
        }
        tokens = new Lexer(input, separators);
        advance();
    }

    private Parsed parseIff() {
        Parsed left = parseImplies();

        if (match(TokenType.IFF)) {
            enterOperand();
            Parsed right = parseIff();
            pending--;
            return binary(new Iff(left.proposition(), right.proposition()), left, right);
        }

        return left;
    }

    private Parsed parseImplies() {
        Parsed left = parseDisjunction();

        if (match(TokenType.IMPLIES)) {
            enterOperand();
            Parsed right = parseImplies();
            pending--;
            return binary(new Implies(left.proposition(), right.proposition()), left, right);
        }

        return left;
    }

    private Parsed parseDisjunction() {
        Parsed result = parseConjunction();

        while (match(TokenType.OR)) {
            Parsed right = parseConjunction();
            result = binary(new Or(result.proposition(), right.proposition()), result, right);
        }

        return result;
    }

    private Parsed parseConjunction() {
        Parsed result = parseNegation();

        while (match(TokenType.AND)) {
            Parsed right = parseNegation();
            result = binary(new And(result.proposition(), right.proposition()), result, right);
        }

        return result;
    }

    private Parsed parseNegation() {
        if (match(TokenType.NOT)) {
            enterOperand();
            Parsed inner = parseNegation();
            pending--;
            return node(new Not(inner.proposition()), inner.height() + 1);
        }
        return parseUnit();
    }

    private Parsed parseUnit() {
        if (check(TokenType.IDENT)) {
            return new Parsed(new Predicate(advance().text()), 0);
        }

        // Grouping adds no node, so only the parenthesis count grows
        if (match(TokenType.LPAREN)) {
            if (++parentheses > maxDepth) {
                throw tooDeep("Parentheses nest deeper than " + maxDepth + " levels");
            }
            Parsed inner = parseIff();
            parentheses--;
            expect(TokenType.RPAREN, "Expected ')'");
            return inner;
        }

        throw error("Expected predicate, '~' or '('");
    }

    /**
     * Every pending {@code ~}, {@code ->} or {@code <->} becomes an ancestor of its operand,
     * so their count bounds the final height from below.
     */
    private void enterOperand() {
        if (++pending > maxDepth) {
            throw tooDeep("Proposition nests deeper than " + maxDepth + " levels");
        }
    }

    private Parsed binary(Proposition proposition, Parsed left, Parsed right) {
        return node(proposition, Math.max(left.height(), right.height()) + 1);
    }

    private Parsed node(Proposition proposition, int height) {
        if (height > maxDepth) {
            throw tooDeep("Proposition nests deeper than " + maxDepth + " levels");
        }
        return new Parsed(proposition, height);
    }

    private NestingDepthException tooDeep(String message) {
        return new NestingDepthException(message + " at position " + current.position()
                + " in '" + PropositionParseException.excerpt(input, current.position()) + "'");
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String message) {
        if (!check(type)) {
            throw error(message);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    /**
     * Move to the next token and return the one just consumed.
     */
    private Token advance() {
        Token previous = current;
        if (tokens.hasNext()) {
            current = tokens.next();
        } else {
            current = new Token(TokenType.EOF, "", input.length());
        }
        return previous;
    }

    private SyntaxException error(String message) {
        String lexeme = check(TokenType.EOF) ? null : current.text();
        return new SyntaxException(message, lexeme, input, current.position());
    }

    /**
     * A parsed subtree with its height in connectives.
     */
    private record Parsed(Proposition proposition, int height) {
    }
}
