package com.plogic.proposition;

import com.plogic.format.Formatter;

import java.util.Objects;

/**
 * Logical disjunction.
 *
 * @param left  Left disjunct
 * @param right Right disjunct
 */
public record Or(Proposition left, Proposition right) implements BinaryProposition {

    public Or {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Connective connective() {
        return Connective.OR;
    }

    @Override
    public String toString() {
        return Formatter.formal(this);
    }
}
