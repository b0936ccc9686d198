package com.formula.expression;

import com.formula.exception.UnbalancedStructureException;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of open function, subexpression and array scopes.
 * Each entry is the START token that opened the scope and the delimiter kind that must close it.
 */
final class BracketStack {

    /**
     * Delimiter kind of an open scope.
     */
    enum Scope {
        /** Function or subexpression, closed by ')'. */
        PAREN('('),
        /** Array literal, closed by '}'. */
        ARRAY('{'),
        /** Row of an array literal, closed by '}' or the row separator. */
        ARRAY_ROW('{');

        private final char opener;

        Scope(char opener) {
            this.opener = opener;
        }

        char opener() {
            return opener;
        }
    }

    private record Entry(Token start, Scope scope) {
    }

    private final List<Entry> entries = new ArrayList<>();

    void push(Token start, Scope scope) {
        entries.add(new Entry(start, scope));
    }

    /**
     * Close the innermost scope.
     *
     * @param name     Value of the STOP token to create
     * @param expected Delimiter kind the closer belongs to
     * @return STOP token of the same type as the closed scope
     * @throws UnbalancedStructureException if no scope is open or the innermost scope is of another kind
     */
    Token pop(String name, Scope expected) {
        if (entries.isEmpty()) {
            throw new UnbalancedStructureException("No open scope to close", -1);
        }
        Entry top = entries.get(entries.size() - 1);
        if (top.scope() != expected) {
            throw new UnbalancedStructureException("Cannot close " + top.scope() + " scope as " + expected, -1);
        }
        entries.remove(entries.size() - 1);
        return Token.of(name, top.start().type(), TokenSubtype.STOP);
    }

    Token peek() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1).start();
    }

    /**
     * Type of the innermost open scope, or null at top level.
     */
    TokenType currentType() {
        Token top = peek();
        return top == null ? null : top.type();
    }

    /**
     * Delimiter kind of the innermost open scope, or null at top level.
     */
    Scope currentScope() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1).scope();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    int depth() {
        return entries.size();
    }
}
