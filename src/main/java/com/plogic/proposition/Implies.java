package com.plogic.proposition;

import com.plogic.format.Formatter;

import java.util.Objects;

/**
 * Material conditional.
 *
 * @param left  Antecedent
 * @param right Consequent
 */
public record Implies(Proposition left, Proposition right) implements BinaryProposition {

    public Implies {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Connective connective() {
        return Connective.IMPLIES;
    }

    @Override
    public String toString() {
        return Formatter.formal(this);
    }
}
