package com.plogic.proposition;

/**
 * Top-level connective of a proposition.
 * <p>
 * Precedence is binding tightness: 1 binds tightest, 5 loosest. A predicate has no
 * connective and sits at 0 so it never needs parentheses.
 */
public enum Connective {
    PREDICATE(0, "", 0, Associativity.NONE),
    NOT(1, "~", 1, Associativity.NONE),
    AND(2, "&", 2, Associativity.LEFT),
    OR(2, "|", 3, Associativity.LEFT),
    IMPLIES(2, "->", 4, Associativity.RIGHT),
    IFF(2, "<->", 5, Associativity.RIGHT);

    private final int degree;
    private final String symbol;
    private final int precedence;
    private final Associativity associativity;

    Connective(int degree, String symbol, int precedence, Associativity associativity) {
        this.degree = degree;
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public int degree() {
        return degree;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    public boolean isBinary() {
        return degree == 2;
    }
}
