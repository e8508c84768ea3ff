package com.plogic.format;

import com.plogic.exception.NestingDepthException;
import com.plogic.proposition.Associativity;
import com.plogic.proposition.BinaryProposition;
import com.plogic.proposition.Connective;
import com.plogic.proposition.Not;
import com.plogic.proposition.Predicate;
import com.plogic.proposition.Proposition;

import java.util.Objects;

/**
 * Renders propositions as text that parses back to an equal proposition.
 */
public final class Formatter {

    private Formatter() {
    }

    public static String format(Proposition proposition, FormatStyle style) {
        return switch (style) {
            case FORMAL -> formal(proposition);
            case CANONICAL -> canonical(proposition);
        };
    }

    /**
     * Fully parenthesized representation, e.g. {@code ((P & Q) & R)}.
     */
    public static String formal(Proposition proposition) {
        Objects.requireNonNull(proposition, "proposition");
        StringBuilder sb = new StringBuilder();
        try {
            appendFormal(proposition, sb);
        } catch (StackOverflowError e) {
            throw new NestingDepthException("Proposition is nested too deeply to format", e);
        }
        return sb.toString();
    }

    /**
     * Minimally parenthesized representation, e.g. {@code P & Q & R}.
     */
    public static String canonical(Proposition proposition) {
        Objects.requireNonNull(proposition, "proposition");
        StringBuilder sb = new StringBuilder();
        try {
            appendCanonical(proposition, sb);
        } catch (StackOverflowError e) {
            throw new NestingDepthException("Proposition is nested too deeply to format", e);
        }
        return sb.toString();
    }

    /**
     * Source-like representation, e.g. {@code Propositions.parse("(P & Q)")}.
     */
    public static String repr(Proposition proposition) {
        String text = formal(proposition)
                .replace("\\", "\\\\")
                .replace("\"", "\\\"");
        return "Propositions.parse(\"" + text + "\")";
    }

    private static void appendFormal(Proposition proposition, StringBuilder sb) {
        switch (proposition.connective()) {
            case PREDICATE -> sb.append(((Predicate) proposition).name());
            case NOT -> {
                sb.append(Connective.NOT.symbol());
                appendFormal(((Not) proposition).inner(), sb);
            }
            case AND, OR, IMPLIES, IFF -> {
                BinaryProposition binary = (BinaryProposition) proposition;
                sb.append('(');
                appendFormal(binary.left(), sb);
                appendOperator(binary.connective(), sb);
                appendFormal(binary.right(), sb);
                sb.append(')');
            }
        }
    }

    private static void appendCanonical(Proposition proposition, StringBuilder sb) {
        switch (proposition.connective()) {
            case PREDICATE -> sb.append(((Predicate) proposition).name());
            case NOT -> {
                Proposition inner = ((Not) proposition).inner();
                sb.append(Connective.NOT.symbol());
                appendOperand(inner, inner.connective().precedence() > Connective.NOT.precedence(), sb);
            }
            case AND, OR, IMPLIES, IFF -> {
                BinaryProposition binary = (BinaryProposition) proposition;
                Connective parent = binary.connective();
                appendOperand(binary.left(), needsParentheses(parent, binary.left(), Associativity.RIGHT), sb);
                appendOperator(parent, sb);
                appendOperand(binary.right(), needsParentheses(parent, binary.right(), Associativity.LEFT), sb);
            }
        }
    }

    /**
     * A child needs parentheses if it binds looser than its parent, or equally loose while
     * sitting on the side the parent does not associate toward.
     *
     * @param parent        Parent connective
     * @param child         Child operand
     * @param groupingSide  Parent associativity under which this side must be parenthesized
     */
    private static boolean needsParentheses(Connective parent, Proposition child, Associativity groupingSide) {
        int childPrecedence = child.connective().precedence();
        if (childPrecedence != parent.precedence()) {
            return childPrecedence > parent.precedence();
        }
        return parent.associativity() == groupingSide;
    }

    private static void appendOperand(Proposition operand, boolean parenthesize, StringBuilder sb) {
        if (parenthesize) {
            sb.append('(');
            appendCanonical(operand, sb);
            sb.append(')');
        } else {
            appendCanonical(operand, sb);
        }
    }

    private static void appendOperator(Connective connective, StringBuilder sb) {
        sb.append(' ').append(connective.symbol()).append(' ');
    }
}
