package com.plogic.exception;

/**
 * Exception thrown when a predicate is created with a name that is not an identifier.
 */
public class InvalidPredicateNameException extends LogicException {

    private final String name;

    public InvalidPredicateNameException(String name) {
        super("Invalid predicate name: '" + name + "'");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
