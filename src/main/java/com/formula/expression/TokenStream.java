package com.formula.expression;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, read-only sequence of tokens produced by {@link FormulaTokenizer}.
 * <p>
 * Traversal state is not kept here: each consumer obtains its own {@link TokenCursor}.
 */
public final class TokenStream implements Iterable<Token> {

    private static final TokenStream EMPTY = new TokenStream(List.of());

    private final List<Token> items;

    private TokenStream(List<Token> items) {
        this.items = items;
    }

    public static TokenStream of(List<Token> tokens) {
        return tokens.isEmpty() ? EMPTY : new TokenStream(List.copyOf(tokens));
    }

    public static TokenStream empty() {
        return EMPTY;
    }

    public Token get(int index) {
        return items.get(index);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<Token> tokens() {
        return items;
    }

    public TokenCursor cursor() {
        return new TokenCursor(this);
    }

    public long count(TokenType type, TokenSubtype subtype) {
        return items.stream()
                .filter(token -> token.type() == type && token.subtype() == subtype)
                .count();
    }

    /**
     * Index of the STOP token that closes the START token at {@code startIndex}.
     *
     * @return index of the matching STOP, or -1 when the scope is never closed
     */
    public int matchingStop(int startIndex) {
        int depth = 0;
        for (int i = startIndex; i < items.size(); i++) {
            Token token = items.get(i);
            if (token.isStart()) {
                depth++;
            } else if (token.isStop() && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the START token of the innermost scope that contains the token at {@code index}.
     *
     * @return index of the enclosing START, or -1 at top level
     */
    public int enclosingStart(int index) {
        int depth = 0;
        for (int i = index - 1; i >= 0; i--) {
            Token token = items.get(i);
            if (token.isStop()) {
                depth++;
            } else if (token.isStart()) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    @Override
    public Iterator<Token> iterator() {
        return items.iterator();
    }

    @Override
    public String toString() {
        return items.stream().map(Token::toString).collect(Collectors.joining(" ", "[", "]"));
    }
}
