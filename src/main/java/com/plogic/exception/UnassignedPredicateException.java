package com.plogic.exception;

/**
 * Exception thrown when evaluation reaches a predicate the interpretation does not assign.
 */
public class UnassignedPredicateException extends LogicException {

    private final String predicate;

    public UnassignedPredicateException(String predicate) {
        super("Predicate '" + predicate + "' is unassigned in the interpretation");
        this.predicate = predicate;
    }

    public String getPredicate() {
        return predicate;
    }
}
