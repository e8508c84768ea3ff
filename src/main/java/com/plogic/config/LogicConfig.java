package com.plogic.config;

import com.plogic.exception.ConfigurationException;
import com.plogic.format.FormatStyle;
import com.plogic.parser.PropositionParser;

/**
 * Library configuration.
 *
 * @param maxDepth     Deepest nesting of parentheses, negations and right-nested
 *                     {@code ->}/{@code <->} chains the parser accepts
 * @param defaultStyle Style used when no explicit style is requested
 */
public record LogicConfig(int maxDepth, FormatStyle defaultStyle) {

    public LogicConfig {
        if (maxDepth <= 0) {
            throw new ConfigurationException("parser.max-depth must be positive, got " + maxDepth);
        }
        if (defaultStyle == null) {
            throw new ConfigurationException("formatter.style cannot be null");
        }
    }

    public static LogicConfig defaults() {
        return new LogicConfig(PropositionParser.DEFAULT_MAX_DEPTH, FormatStyle.CANONICAL);
    }
}
