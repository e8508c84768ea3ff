package com.plogic.proposition;

import com.plogic.evaluation.Evaluator;
import com.plogic.evaluation.Interpretation;
import com.plogic.exception.AmbiguousTruthValueException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A formula of propositional logic.
 * <p>
 * Propositions are immutable trees compared structurally: {@code P & Q} is not equal to
 * {@code Q & P}. The family is closed; dispatch on {@link #connective()} is exhaustive.
 * <p>
 * Operation summary:
 * <ul>
 *   <li>{@link #child(int)}, {@link #children()}: immediate components</li>
 *   <li>{@link #not()}, {@link #and}, {@link #or}, {@link #implies}, {@link #iff}: composition</li>
 *   <li>{@link #evaluate(Map)}: truth value under an assignment</li>
 *   <li>{@link #toString()}: formal representation</li>
 * </ul>
 * {@link #booleanValue()} always fails; a proposition has no truth value of its own.
 */
public sealed interface Proposition permits Predicate, Not, BinaryProposition {

    /**
     * Get the top-level connective.
     */
    Connective connective();

    /**
     * Number of immediate components: 0 for a predicate, 1 for a negation, 2 otherwise.
     * Only the outermost connective counts, so {@code ~~P} has degree 1.
     */
    default int degree() {
        return connective().degree();
    }

    /**
     * Get the immediate component at the given index.
     *
     * @param index Index in {@code [0, degree())}
     * @return Component proposition
     * @throws com.plogic.exception.ArityException if the index is out of range
     */
    Proposition child(int index);

    /**
     * Immediate components in order. Empty for a predicate.
     */
    default List<Proposition> children() {
        List<Proposition> children = new ArrayList<>(degree());
        for (int i = 0; i < degree(); i++) {
            children.add(child(i));
        }
        return Collections.unmodifiableList(children);
    }

    default Not not() {
        return new Not(this);
    }

    default And and(Proposition other) {
        return new And(this, other);
    }

    default Or or(Proposition other) {
        return new Or(this, other);
    }

    default Implies implies(Proposition other) {
        return new Implies(this, other);
    }

    default Iff iff(Proposition other) {
        return new Iff(this, other);
    }

    /**
     * Truth value under the given assignment of predicate names.
     *
     * @param assignment Predicate name to truth value
     * @return Truth value
     * @throws com.plogic.exception.UnassignedPredicateException if a predicate is not assigned
     */
    default boolean evaluate(Map<String, Boolean> assignment) {
        return Evaluator.evaluate(this, Interpretation.of(assignment));
    }

    default boolean evaluate(Interpretation interpretation) {
        return Evaluator.evaluate(this, interpretation);
    }

    /**
     * Not supported.
     *
     * @throws AmbiguousTruthValueException always
     */
    default boolean booleanValue() {
        throw new AmbiguousTruthValueException();
    }
}
