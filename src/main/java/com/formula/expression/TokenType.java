package com.formula.expression;

/**
 * Token types produced by the formula tokenizer.
 */
public enum TokenType {
    // Values
    OPERAND,

    // Structure
    FUNCTION,
    SUBEXPRESSION,
    ARGUMENT,

    // Operators
    OPERATOR_PREFIX,
    OPERATOR_INFIX,
    OPERATOR_POSTFIX,

    // Transient, never present in a finished stream
    WHITE_SPACE,
    NOOP,

    UNKNOWN
}
