package com.formula.format;

import com.formula.expression.Token;
import com.formula.expression.TokenSubtype;
import com.formula.expression.TokenType;
import com.formula.render.TokenRewriter;

import java.util.Locale;
import java.util.Map;

/**
 * Rewrites formula tokens into the lexical equivalents of a target language.
 * <p>
 * The {@code IF} function name is dropped so that {@code IF(a,b,c)} renders as {@code (a, b, c)}.
 * Languages with the same lexicon share one rewriter.
 */
public final class CrossLanguageRewriter implements TokenRewriter {

    private static final String IF = "IF";

    private final Map<String, String> lexicon;

    public CrossLanguageRewriter(Map<String, String> lexicon) {
        this.lexicon = Map.copyOf(lexicon);
    }

    public static CrossLanguageRewriter forLanguage(TargetLanguage language) {
        return new CrossLanguageRewriter(language.lexicon());
    }

    @Override
    public Rewrite rewrite(String text, Token token) {
        String upper = text.toUpperCase(Locale.ROOT);
        String translated = lexicon.getOrDefault(upper, text);

        if (token.type() == TokenType.FUNCTION && token.isStart()) {
            return Rewrite.template(IF.equals(upper) ? "" : translated);
        }
        if (token.type() == TokenType.FUNCTION && token.isStop()) {
            return Rewrite.literal(")");
        }
        if (token.type() == TokenType.ARGUMENT) {
            return Rewrite.literal(", ");
        }
        if (token.isOperand() && token.subtype() == TokenSubtype.TEXT) {
            return Rewrite.literal('"' + escape(text) + '"');
        }
        if (token.type() == TokenType.OPERATOR_INFIX) {
            return Rewrite.literal(" " + translated + " ");
        }
        return Rewrite.template(translated);
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
