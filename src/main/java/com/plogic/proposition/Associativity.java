package com.plogic.proposition;

/**
 * How a chain of the same connective groups.
 */
public enum Associativity {
    LEFT,
    RIGHT,
    NONE
}
