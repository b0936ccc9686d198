package com.formula.expression;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical constants for formula tokenizing.
 */
public final class TokenizerConfig {

    private TokenizerConfig() {
    }

    /**
     * Error literals. An error literal ends as soon as the accumulated text equals one of these.
     */
    public static final Set<String> ERROR_LITERALS = Set.of(
            "#NULL!", "#DIV/0!", "#VALUE!", "#REF!", "#NAME?", "#NUM!", "#N/A"
    );

    /**
     * Two-character comparison operators, matched before single-character ones.
     */
    public static final Set<String> COMPARISON_OPERATORS = Set.of("<=", ">=", "<>");

    public static final String INFIX_OPERATORS = "+-*/^&=><";

    public static final Set<String> LOGICAL_VALUES = Set.of("TRUE", "FALSE");

    public static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Names of the function scopes opened by an array literal.
     */
    public static final String ARRAY = "ARRAY";
    public static final String ARRAY_ROW = "ARRAYROW";

    /**
     * Operator and delimiter symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACE = '{';
        public static final char RIGHT_BRACE = '}';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char HASH = '#';
        public static final char PERCENT = '%';
        public static final char COMMA = ',';
        public static final char SEMICOLON = ';';
        public static final char EQUALS = '=';
        public static final char PLUS = '+';
        public static final char MINUS = '-';

        private Operators() {
        }
    }

    /**
     * List separator for the given locale convention.
     */
    public static char listSeparator(boolean semicolon) {
        return semicolon ? Operators.SEMICOLON : Operators.COMMA;
    }
}
