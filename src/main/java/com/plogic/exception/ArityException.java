package com.plogic.exception;

/**
 * Exception thrown when a child index is outside {@code [0, degree)}.
 */
public class ArityException extends LogicException {

    private final int index;
    private final int degree;

    public ArityException(int index, int degree) {
        super(degree == 0
                ? "Predicate has no component propositions; got " + index
                : "Expected index in [0, " + degree + "); got " + index);
        this.index = index;
        this.degree = degree;
    }

    public int getIndex() {
        return index;
    }

    public int getDegree() {
        return degree;
    }
}
