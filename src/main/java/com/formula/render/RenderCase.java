package com.formula.render;

import com.formula.expression.Token;

import java.util.Arrays;
import java.util.Optional;

/**
 * Token categories that are rendered through a template.
 * Each case has a configuration key used in template files.
 */
public enum RenderCase {
    FUNCTION_START("function-start"),
    FUNCTION_STOP("function-stop"),
    OPERAND_TEXT("operand-text"),
    OPERAND_NUMBER("operand-number"),
    OPERAND_LOGICAL("operand-logical"),
    OPERAND_RANGE("operand-range"),
    OPERAND_ERROR("operand-error"),
    ARGUMENT("argument"),
    OPERATOR_INFIX("operator-infix"),
    SUBEXPRESSION_START("subexpression-start"),
    SUBEXPRESSION_STOP("subexpression-stop");

    private final String key;

    RenderCase(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<RenderCase> fromKey(String key) {
        return Arrays.stream(values())
                .filter(renderCase -> renderCase.key.equals(key))
                .findFirst();
    }

    /**
     * Render case for a token. Empty for prefix and postfix operators, unknown tokens
     * and operands without a rendered subtype; those are written as indent plus text.
     */
    public static Optional<RenderCase> of(Token token) {
        return Optional.ofNullable(switch (token.type()) {
            case FUNCTION -> token.isStart() ? FUNCTION_START : FUNCTION_STOP;
            case SUBEXPRESSION -> token.isStart() ? SUBEXPRESSION_START : SUBEXPRESSION_STOP;
            case ARGUMENT -> ARGUMENT;
            case OPERATOR_INFIX -> OPERATOR_INFIX;
            case OPERAND -> switch (token.subtype()) {
                case TEXT -> OPERAND_TEXT;
                case NUMBER -> OPERAND_NUMBER;
                case LOGICAL -> OPERAND_LOGICAL;
                case RANGE -> OPERAND_RANGE;
                case ERROR -> OPERAND_ERROR;
                default -> null;
            };
            default -> null;
        });
    }
}
