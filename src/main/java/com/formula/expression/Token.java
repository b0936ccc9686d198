package com.formula.expression;

import java.util.Objects;

/**
 * Represents a token in a formula.
 *
 * @param value   Token text (unescaped for text operands)
 * @param type    Token type
 * @param subtype Token subtype, {@link TokenSubtype#NONE} when the type carries none
 */
public record Token(String value, TokenType type, TokenSubtype subtype) {

    public Token {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(subtype, "subtype");
    }

    public static Token of(String value, TokenType type) {
        return new Token(value, type, TokenSubtype.NONE);
    }

    public static Token of(String value, TokenType type, TokenSubtype subtype) {
        return new Token(value, type, subtype);
    }

    public Token withType(TokenType newType) {
        return new Token(value, newType, subtype);
    }

    public Token withSubtype(TokenSubtype newSubtype) {
        return new Token(value, type, newSubtype);
    }

    public boolean isStart() {
        return subtype == TokenSubtype.START;
    }

    public boolean isStop() {
        return subtype == TokenSubtype.STOP;
    }

    public boolean isOperand() {
        return type == TokenType.OPERAND;
    }

    public boolean hasSubtype() {
        return subtype != TokenSubtype.NONE;
    }

    @Override
    public String toString() {
        if (hasSubtype()) {
            return type + "/" + subtype + "(" + value + ")";
        }
        return type + "(" + value + ")";
    }
}
