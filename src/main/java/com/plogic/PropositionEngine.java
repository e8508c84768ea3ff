package com.plogic;

import com.plogic.config.LogicConfig;
import com.plogic.evaluation.Evaluator;
import com.plogic.evaluation.Interpretation;
import com.plogic.format.FormatStyle;
import com.plogic.format.Formatter;
import com.plogic.parser.PropositionParser;
import com.plogic.proposition.Proposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses, formats and evaluates propositions under a {@link LogicConfig}.
 * Stateless apart from its configuration, so one instance can be shared.
 */
public class PropositionEngine {

    private static final Logger log = LoggerFactory.getLogger(PropositionEngine.class);

    private final LogicConfig config;

    public PropositionEngine(LogicConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public LogicConfig getConfig() {
        return config;
    }

    /**
     * Parse exactly one proposition.
     *
     * @param text Proposition text, e.g. {@code "P & Q -> R"}
     * @return Parsed proposition
     */
    public Proposition parse(String text) {
        Objects.requireNonNull(text, "text");
        Proposition result = new PropositionParser(text, config.maxDepth()).parse();
        log.debug("Parsed '{}' as {}", text, result);
        return result;
    }

    /**
     * Parse comma-separated propositions, e.g. {@code "P, Q | R"}.
     *
     * @param text Proposition list text
     * @return Parsed propositions, empty for blank text
     */
    public List<Proposition> parseMany(String text) {
        Objects.requireNonNull(text, "text");
        List<Proposition> result = new PropositionParser(text, config.maxDepth()).parseAll();
        log.debug("Parsed {} propositions from '{}'", result.size(), text);
        return result;
    }

    /**
     * Format in the configured default style.
     */
    public String format(Proposition proposition) {
        return Formatter.format(proposition, config.defaultStyle());
    }

    public String format(Proposition proposition, FormatStyle style) {
        return Formatter.format(proposition, style);
    }

    public boolean evaluate(Proposition proposition, Interpretation interpretation) {
        return Evaluator.evaluate(proposition, interpretation);
    }

    public boolean evaluate(Proposition proposition, Map<String, Boolean> assignment) {
        return Evaluator.evaluate(proposition, Interpretation.of(assignment));
    }

    /**
     * Parse and evaluate in one step.
     *
     * @param text       Proposition text
     * @param assignment Predicate name to truth value
     * @return Truth value
     */
    public boolean evaluate(String text, Map<String, Boolean> assignment) {
        return evaluate(parse(text), assignment);
    }
}
