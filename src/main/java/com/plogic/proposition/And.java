package com.plogic.proposition;

import com.plogic.format.Formatter;

import java.util.Objects;

/**
 * Logical conjunction.
 *
 * @param left  Left conjunct
 * @param right Right conjunct
 */
public record And(Proposition left, Proposition right) implements BinaryProposition {

    public And {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Connective connective() {
        return Connective.AND;
    }

    @Override
    public String toString() {
        return Formatter.formal(this);
    }
}
