package com.plogic.proposition;

import com.plogic.exception.ArityException;
import com.plogic.exception.InvalidPredicateNameException;
import com.plogic.format.Formatter;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A nullary predicate, serving as a propositional variable.
 *
 * @param name Identifier matching {@code [A-Za-z_][A-Za-z0-9_]*}
 */
public record Predicate(String name) implements Proposition {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public Predicate {
        Objects.requireNonNull(name, "name");
        if (!isValidName(name)) {
            throw new InvalidPredicateNameException(name);
        }
    }

    /**
     * Check whether a string may be used as a predicate name.
     */
    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    @Override
    public Connective connective() {
        return Connective.PREDICATE;
    }

    @Override
    public Proposition child(int index) {
        throw new ArityException(index, 0);
    }

    @Override
    public String toString() {
        return Formatter.formal(this);
    }
}
