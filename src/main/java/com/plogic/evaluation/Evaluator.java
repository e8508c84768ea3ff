package com.plogic.evaluation;

import com.plogic.exception.NestingDepthException;
import com.plogic.exception.UnassignedPredicateException;
import com.plogic.proposition.BinaryProposition;
import com.plogic.proposition.Connective;
import com.plogic.proposition.Not;
import com.plogic.proposition.Predicate;
import com.plogic.proposition.Proposition;

import java.util.Objects;

/**
 * Computes the truth value of a proposition under an interpretation.
 * <p>
 * Evaluation is eager: both operands of a binary connective are always evaluated, so an
 * unassigned predicate is reported even when the other operand alone decides the result.
 * {@code P & Q} under {@code {P: false}} fails rather than returning false.
 */
public final class Evaluator {

    private Evaluator() {
    }

    /**
     * Evaluate a proposition.
     *
     * @param proposition    Proposition to evaluate
     * @param interpretation Truth values of its predicates
     * @return Truth value
     * @throws UnassignedPredicateException if a predicate has no assigned value
     * @throws NestingDepthException        if the tree is too deep to walk
     */
    public static boolean evaluate(Proposition proposition, Interpretation interpretation) {
        Objects.requireNonNull(proposition, "proposition");
        Objects.requireNonNull(interpretation, "interpretation");
        try {
            return evaluateNode(proposition, interpretation);
        } catch (StackOverflowError e) {
            throw new NestingDepthException("Proposition is nested too deeply to evaluate", e);
        }
    }

    private static boolean evaluateNode(Proposition proposition, Interpretation interpretation) {
        return switch (proposition.connective()) {
            case PREDICATE -> lookup((Predicate) proposition, interpretation);
            case NOT -> !evaluateNode(((Not) proposition).inner(), interpretation);
            case AND, OR, IMPLIES, IFF -> {
                BinaryProposition binary = (BinaryProposition) proposition;
                boolean left = evaluateNode(binary.left(), interpretation);
                boolean right = evaluateNode(binary.right(), interpretation);
                yield apply(binary.connective(), left, right);
            }
        };
    }

    private static boolean lookup(Predicate predicate, Interpretation interpretation) {
        return interpretation.valueOf(predicate.name())
                .orElseThrow(() -> new UnassignedPredicateException(predicate.name()));
    }

    /**
     * Truth function of a binary connective.
     */
    static boolean apply(Connective connective, boolean left, boolean right) {
        return switch (connective) {
            case AND -> left && right;
            case OR -> left || right;
            case IMPLIES -> !left || right;
            case IFF -> left == right;
            case PREDICATE, NOT -> throw new IllegalArgumentException(connective + " is not a binary connective");
        };
    }
}
