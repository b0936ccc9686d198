package com.formula.expression;

/**
 * Token subtypes. Many token types carry {@link #NONE}.
 */
public enum TokenSubtype {
    NONE,

    // Scope boundaries for functions and subexpressions
    START,
    STOP,

    // Operand kinds
    TEXT,
    NUMBER,
    LOGICAL,
    ERROR,
    RANGE,

    // Reference operators
    INTERSECT,
    UNION
}
