package com.formula.expression;

/**
 * Forward cursor over a {@link TokenStream} with one token of lookahead and lookbehind.
 * The cursor starts before the first token; call {@link #moveNext()} to reach it.
 */
public final class TokenCursor {

    private final TokenStream stream;
    private int index;

    TokenCursor(TokenStream stream) {
        this.stream = stream;
        this.index = -1;
    }

    public void reset() {
        index = -1;
    }

    /**
     * True when the cursor is on the first token or before it.
     */
    public boolean isBof() {
        return index <= 0;
    }

    /**
     * True when the cursor is on the last token (or the stream is empty).
     */
    public boolean isEof() {
        return index >= stream.size() - 1;
    }

    public boolean moveNext() {
        if (isEof()) {
            return false;
        }
        index++;
        return true;
    }

    public Token current() {
        return index == -1 ? null : stream.get(index);
    }

    public Token next() {
        return isEof() ? null : stream.get(index + 1);
    }

    public Token previous() {
        return index < 1 ? null : stream.get(index - 1);
    }

    public int index() {
        return index;
    }

    public TokenStream stream() {
        return stream;
    }
}
