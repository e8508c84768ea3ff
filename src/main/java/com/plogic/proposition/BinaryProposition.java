package com.plogic.proposition;

import com.plogic.exception.ArityException;

/**
 * A proposition built with a two-place connective.
 */
public sealed interface BinaryProposition extends Proposition permits And, Or, Implies, Iff {

    Proposition left();

    Proposition right();

    @Override
    default Proposition child(int index) {
        return switch (index) {
            case 0 -> left();
            case 1 -> right();
            default -> throw new ArityException(index, 2);
        };
    }
}
