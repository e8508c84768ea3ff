package com.plogic.evaluation;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Assigns truth values to predicate names.
 */
@FunctionalInterface
public interface Interpretation {

    /**
     * Resolve a predicate name.
     *
     * @param name Predicate name
     * @return Assigned truth value, or empty if the name is unassigned
     */
    Optional<Boolean> valueOf(String name);

    /**
     * Interpretation backed by a map. The map is read on each lookup, not copied;
     * a {@code null} value counts as unassigned.
     *
     * @param assignment Predicate name to truth value
     * @return Interpretation over the map
     */
    static Interpretation of(Map<String, Boolean> assignment) {
        Objects.requireNonNull(assignment, "assignment");
        return name -> Optional.ofNullable(assignment.get(name));
    }

    /**
     * Interpretation that assigns nothing.
     */
    static Interpretation empty() {
        return name -> Optional.empty();
    }
}
