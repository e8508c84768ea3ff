package com.plogic.format;

/**
 * Text rendering styles.
 */
public enum FormatStyle {
    /**
     * Every binary operation in parentheses: {@code ((P & Q) & R)}.
     */
    FORMAL,

    /**
     * Parentheses only where precedence or associativity require them: {@code P & Q & R}.
     */
    CANONICAL
}
