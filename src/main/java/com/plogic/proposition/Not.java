package com.plogic.proposition;

import com.plogic.exception.ArityException;
import com.plogic.format.Formatter;

import java.util.Objects;

/**
 * Logical negation.
 *
 * @param inner Negated operand
 */
public record Not(Proposition inner) implements Proposition {

    public Not {
        Objects.requireNonNull(inner, "inner");
    }

    @Override
    public Connective connective() {
        return Connective.NOT;
    }

    @Override
    public Proposition child(int index) {
        if (index == 0) {
            return inner;
        }
        throw new ArityException(index, 1);
    }

    @Override
    public String toString() {
        return Formatter.formal(this);
    }
}
