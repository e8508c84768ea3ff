package com.plogic.proposition;

import com.plogic.format.Formatter;

import java.util.Objects;

/**
 * Biconditional.
 *
 * @param left  Left operand
 * @param right Right operand
 */
public record Iff(Proposition left, Proposition right) implements BinaryProposition {

    public Iff {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Connective connective() {
        return Connective.IFF;
    }

    @Override
    public String toString() {
        return Formatter.formal(this);
    }
}
