package com.formula.render;

import com.formula.expression.Token;
import com.formula.expression.TokenCursor;

/**
 * Per-token rendering hook, invoked before the template lookup.
 * Target-language emitters implement this to translate operators and literals.
 */
@FunctionalInterface
public interface TokenRewriter {

    /**
     * Rewrite a token.
     *
     * @param text  Current token text
     * @param token The token being rendered
     * @return Replacement text, and whether the default template still applies
     */
    Rewrite rewrite(String text, Token token);

    /**
     * Rewrite a token that needs its surroundings, such as the scope it belongs to.
     * The renderer calls this variant; by default it ignores the cursor.
     *
     * @param cursor Cursor positioned on {@code token}
     */
    default Rewrite rewrite(String text, Token token, TokenCursor cursor) {
        return rewrite(text, token);
    }

    /**
     * Result of a rewrite.
     *
     * @param text        Text to render
     * @param useTemplate true to pass the text through the token's template,
     *                    false to emit it literally
     * @param indented    for literal text, whether the token's indentation is written before it
     */
    record Rewrite(String text, boolean useTemplate, boolean indented) {

        public Rewrite(String text, boolean useTemplate) {
            this(text, useTemplate, false);
        }

        public static Rewrite template(String text) {
            return new Rewrite(text, true);
        }

        public static Rewrite literal(String text) {
            return new Rewrite(text, false);
        }

        public static Rewrite indentedLiteral(String text) {
            return new Rewrite(text, false, true);
        }

        public Rewrite withText(String newText) {
            return new Rewrite(newText, useTemplate, indented);
        }
    }
}
