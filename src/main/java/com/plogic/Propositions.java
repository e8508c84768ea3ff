package com.plogic;

import com.plogic.config.LogicConfig;
import com.plogic.format.Formatter;
import com.plogic.proposition.Predicate;
import com.plogic.proposition.Proposition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Static entry points using the default configuration.
 * <p>
 * Syntax, loosest first:
 * <ul>
 *   <li>{@code <->}: biconditional, right associative</li>
 *   <li>{@code ->}: conditional, right associative</li>
 *   <li>{@code |}: disjunction, left associative</li>
 *   <li>{@code &}: conjunction, left associative</li>
 *   <li>{@code ~}: negation, prefix</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * Predicate names match {@code [A-Za-z_][A-Za-z0-9_]*}.
 */
public final class Propositions {

    private static final PropositionEngine DEFAULT_ENGINE = new PropositionEngine(LogicConfig.defaults());

    private Propositions() {
    }

    /**
     * Parse a proposition.
     *
     * @param text Proposition text
     * @return Parsed proposition
     */
    public static Proposition parse(String text) {
        return DEFAULT_ENGINE.parse(text);
    }

    /**
     * Parse comma-separated propositions.
     *
     * @param text Proposition list text, e.g. {@code "P, Q, P & Q"}
     * @return Parsed propositions in order
     */
    public static List<Proposition> parseMany(String text) {
        return DEFAULT_ENGINE.parseMany(text);
    }

    /**
     * Create one predicate per whitespace-separated name, in order, keeping duplicates.
     *
     * @param names Names separated by whitespace, e.g. {@code "P Q R"}
     * @return Predicates, empty for blank input
     */
    public static List<Predicate> predicates(String names) {
        Objects.requireNonNull(names, "names");
        String trimmed = names.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return predicates(List.of(trimmed.split("\\s+")));
    }

    public static List<Predicate> predicates(Iterable<String> names) {
        Objects.requireNonNull(names, "names");
        List<Predicate> result = new ArrayList<>();
        for (String name : names) {
            result.add(new Predicate(name));
        }
        return List.copyOf(result);
    }

    public static String formal(Proposition proposition) {
        return Formatter.formal(proposition);
    }

    public static String canonical(Proposition proposition) {
        return Formatter.canonical(proposition);
    }
}
