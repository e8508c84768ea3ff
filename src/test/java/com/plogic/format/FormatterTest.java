package com.plogic.format;

import com.plogic.exception.NestingDepthException;
import com.plogic.parser.PropositionParser;
import com.plogic.proposition.And;
import com.plogic.proposition.Iff;
import com.plogic.proposition.Implies;
import com.plogic.proposition.Not;
import com.plogic.proposition.Or;
import com.plogic.proposition.Predicate;
import com.plogic.proposition.Proposition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Formatter.
 */
class FormatterTest {

    private static final Predicate P = new Predicate("P");
    private static final Predicate Q = new Predicate("Q");
    private static final Predicate R = new Predicate("R");
    private static final Predicate S = new Predicate("S");
    private static final Predicate T = new Predicate("T");

    private static Proposition parse(String text) {
        return new PropositionParser(text).parse();
    }

    static Stream<Arguments> formalCases() {
        Predicate p = new Predicate("p");
        Predicate q = new Predicate("q");
        return Stream.of(
                Arguments.of(p, "p"),
                Arguments.of(new Predicate("ANY_NamE"), "ANY_NamE"),
                Arguments.of(new Not(p), "~p"),
                Arguments.of(new And(p, q), "(p & q)"),
                Arguments.of(new Or(p, q), "(p | q)"),
                Arguments.of(new Implies(p, q), "(p -> q)"),
                Arguments.of(new Iff(p, q), "(p <-> q)"),
                Arguments.of(new Not(new Not(new Not(new Not(p)))), "~~~~p"),
                Arguments.of(new Not(new And(p, q)), "~(p & q)"),
                Arguments.of(new Implies(new And(new Implies(p, q), p), q), "(((p -> q) & p) -> q)"),
                Arguments.of(new Iff(new Iff(p, q), new And(new Implies(p, q), new Implies(q, p))),
                        "((p <-> q) <-> ((p -> q) & (q -> p)))"),
                Arguments.of(new Iff(new Iff(p, q), new Or(new And(p, q), new And(new Not(p), new Not(q)))),
                        "((p <-> q) <-> ((p & q) | (~p & ~q)))")
        );
    }

    @ParameterizedTest
    @MethodSource("formalCases")
    @DisplayName("Should parenthesize every binary operation in formal style")
    void shouldFormatFormal(Proposition u, String expected) {
        assertEquals(expected, Formatter.formal(u));
        assertEquals(expected, Formatter.format(u, FormatStyle.FORMAL));
        assertEquals(expected, u.toString());
    }

    static Stream<Arguments> canonicalCases() {
        return Stream.of(
                Arguments.of(P, "P"),
                Arguments.of(new Not(P), "~P"),
                Arguments.of(new Not(new Not(P)), "~~P"),
                Arguments.of(new Not(new And(P, Q)), "~(P & Q)"),
                Arguments.of(new Not(new Iff(P, Q)), "~(P <-> Q)"),
                Arguments.of(new And(new Not(P), new Not(Q)), "~P & ~Q"),

                // Associativity
                Arguments.of(new And(new And(P, Q), R), "P & Q & R"),
                Arguments.of(new And(P, new And(Q, R)), "P & (Q & R)"),
                Arguments.of(new Or(new Or(P, Q), R), "P | Q | R"),
                Arguments.of(new Or(P, new Or(Q, R)), "P | (Q | R)"),
                Arguments.of(new Implies(P, new Implies(Q, R)), "P -> Q -> R"),
                Arguments.of(new Implies(new Implies(P, Q), R), "(P -> Q) -> R"),
                Arguments.of(new Iff(P, new Iff(Q, R)), "P <-> Q <-> R"),
                Arguments.of(new Iff(new Iff(P, Q), R), "(P <-> Q) <-> R"),

                // Precedence
                Arguments.of(new Or(new And(P, Q), R), "P & Q | R"),
                Arguments.of(new And(new Or(P, Q), R), "(P | Q) & R"),
                Arguments.of(new And(P, new Or(Q, R)), "P & (Q | R)"),
                Arguments.of(new Implies(new Or(P, Q), new And(Q, R)), "P | Q -> Q & R"),
                Arguments.of(new Or(new Implies(P, Q), R), "(P -> Q) | R"),
                Arguments.of(new Implies(new Iff(P, Q), R), "(P <-> Q) -> R"),
                Arguments.of(new Iff(new Implies(P, Q), R), "P -> Q <-> R"),
                Arguments.of(new Iff(P, new Implies(Q, new Or(R, new And(S, new Not(T))))),
                        "P <-> Q -> R | S & ~T"),
                Arguments.of(new Iff(new Implies(new Or(new And(new Not(P), Q), R), S), T),
                        "~P & Q | R -> S <-> T"),
                Arguments.of(new Iff(new Iff(P, Q), new And(new Implies(P, Q), new Implies(Q, P))),
                        "(P <-> Q) <-> (P -> Q) & (Q -> P)")
        );
    }

    @ParameterizedTest
    @MethodSource("canonicalCases")
    @DisplayName("Should omit redundant parentheses in canonical style")
    void shouldFormatCanonical(Proposition u, String expected) {
        assertEquals(expected, Formatter.canonical(u));
        assertEquals(expected, Formatter.format(u, FormatStyle.CANONICAL));
    }

    @ParameterizedTest
    @MethodSource("canonicalCases")
    @DisplayName("Should parse canonical and formal text back to the same tree")
    void shouldRoundTripKnownCases(Proposition u) {
        assertEquals(u, parse(Formatter.canonical(u)));
        assertEquals(u, parse(Formatter.formal(u)));
    }

    @Test
    @DisplayName("Should round-trip randomly generated trees under a depth limit equal to their height")
    void shouldRoundTripRandomTrees() {
        Random random = new Random(20231019L);
        List<Predicate> atoms = List.of(P, Q, R, S, T);

        for (int i = 0; i < 2_000; i++) {
            Proposition u = randomTree(random, atoms, 6);

            String canonical = Formatter.canonical(u);
            String formal = Formatter.formal(u);
            assertEquals(u, new PropositionParser(canonical, 6).parse(), () -> "canonical: " + canonical);
            assertEquals(u, new PropositionParser(formal, 6).parse(), () -> "formal: " + formal);
            assertTrue(canonical.length() <= formal.length(), () -> canonical + " vs " + formal);
        }
    }

    static Stream<String> deepestAcceptedTexts() {
        int depth = PropositionParser.DEFAULT_MAX_DEPTH;
        return Stream.of(
                "P" + " & P".repeat(depth),
                "P" + " | P".repeat(depth),
                "P" + " -> P".repeat(depth),
                "P" + " <-> P".repeat(depth),
                "~".repeat(depth) + "P",
                "~(P & ".repeat(depth / 2) + "P" + ")".repeat(depth / 2),
                "(" + "P & ".repeat(depth - 1) + "P) -> P"
        );
    }

    @ParameterizedTest
    @MethodSource("deepestAcceptedTexts")
    @DisplayName("Should round-trip the deepest trees the parser accepts")
    void shouldRoundTripDeepestAcceptedTrees(String text) {
        Proposition u = parse(text);

        assertEquals(u, parse(Formatter.formal(u)));
        assertEquals(u, parse(Formatter.canonical(u)));
    }

    @Test
    @DisplayName("Should reject a chain one level beyond the limit before it can be formatted")
    void shouldRejectChainBeyondLimit() {
        assertThrows(NestingDepthException.class,
                () -> parse("P" + " & P".repeat(PropositionParser.DEFAULT_MAX_DEPTH + 1)));
        assertThrows(NestingDepthException.class, () -> parse("P" + " & P".repeat(600)));
    }

    @Test
    @DisplayName("Should produce the canonical form from any equivalent parenthesization")
    void shouldNormalizeParentheses() {
        List<String> spellings = new ArrayList<>(List.of(
                "((P & Q) & R) | (~S)",
                "(((P) & (Q)) & (R)) | ~(S)",
                "P & Q & R | ~S"
        ));

        for (String spelling : spellings) {
            assertEquals("P & Q & R | ~S", Formatter.canonical(parse(spelling)));
        }
    }

    @Test
    @DisplayName("Should render a source-like representation")
    void shouldRenderRepr() {
        assertEquals("Propositions.parse(\"((P & Q) -> ~R)\")",
                Formatter.repr(new Implies(new And(P, Q), new Not(R))));
        assertEquals("Propositions.parse(\"P\")", Formatter.repr(P));
    }

    @Test
    @DisplayName("Should report trees too deep to format")
    void shouldReportDeepTrees() {
        Proposition deep = P;
        for (int i = 0; i < 1_000_000; i++) {
            deep = new And(P, deep);
        }
        Proposition tree = deep;

        assertThrows(NestingDepthException.class, () -> Formatter.formal(tree));
        assertThrows(NestingDepthException.class, () -> Formatter.canonical(tree));
    }

    private static Proposition randomTree(Random random, List<Predicate> atoms, int depth) {
        int choice = depth == 0 ? 0 : random.nextInt(7);
        return switch (choice) {
            case 1 -> new Not(randomTree(random, atoms, depth - 1));
            case 2 -> new And(randomTree(random, atoms, depth - 1), randomTree(random, atoms, depth - 1));
            case 3 -> new Or(randomTree(random, atoms, depth - 1), randomTree(random, atoms, depth - 1));
            case 4 -> new Implies(randomTree(random, atoms, depth - 1), randomTree(random, atoms, depth - 1));
            case 5 -> new Iff(randomTree(random, atoms, depth - 1), randomTree(random, atoms, depth - 1));
            default -> atoms.get(random.nextInt(atoms.size()));
        };
    }
}
