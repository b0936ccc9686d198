package com.formula.render;

import com.formula.expression.Token;
import com.formula.expression.TokenCursor;
import com.formula.expression.TokenStream;
import com.formula.expression.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Renders a token stream to text through a {@link TemplateConfig}.
 * <p>
 * Indentation follows scope depth: START tokens open a level after they are written,
 * STOP tokens close it before they are written and always start a line. Other tokens
 * are indented only when the output so far ends with the configured newline.
 */
public final class FormulaRenderer {

    private static final Logger log = LoggerFactory.getLogger(FormulaRenderer.class);

    private FormulaRenderer() {
    }

    /**
     * Render tokens to a string.
     *
     * @param tokens Finished token stream
     * @param config Templates and layout strings
     * @return prefix, trimmed rendering, postfix
     * @throws com.formula.exception.ConfigurationException if a token's render case has no template
     */
    public static String render(TokenStream tokens, TemplateConfig config) {
        StringBuilder output = new StringBuilder();
        TokenCursor cursor = tokens.cursor();
        int depth = 0;
        boolean lineStart = true;

        while (cursor.moveNext()) {
            Token token = cursor.current();

            int level = token.isStop() ? Math.max(0, depth - 1) : depth;
            boolean startsLine = token.isStop() || lineStart;
            String indent = startsLine ? config.indentUnit().repeat(level) : "";

            Token next = cursor.next();
            String lineBreak = next != null && next.type() == TokenType.ARGUMENT ? config.newLine() : "";

            output.append(renderToken(token, cursor, config, indent, lineBreak));

            if (token.isStart()) {
                depth++;
            } else if (token.isStop()) {
                depth = Math.max(0, depth - 1);
            }
            lineStart = token.isStop() || endsWith(output, config.newLine());
        }

        log.debug("Rendered {} tokens into {} chars", tokens.size(), output.length());
        return config.prefix() + output.toString().strip() + config.postfix();
    }

    private static String renderToken(Token token, TokenCursor cursor, TemplateConfig config,
                                      String indent, String lineBreak) {
        String text = token.value();

        Optional<TokenRewriter> rewriter = config.rewriter();
        if (rewriter.isPresent()) {
            TokenRewriter.Rewrite rewrite = rewriter.get().rewrite(text, token, cursor);
            text = rewrite.text();
            if (!rewrite.useTemplate()) {
                return rewrite.indented() ? indent + text : text;
            }
        }

        Optional<RenderCase> renderCase = RenderCase.of(token);
        if (renderCase.isEmpty()) {
            return indent + text;
        }
        return config.requireTemplate(renderCase.get()).apply(indent, text, lineBreak);
    }

    private static boolean endsWith(StringBuilder output, String suffix) {
        int start = output.length() - suffix.length();
        return start >= 0 && output.indexOf(suffix, start) == start;
    }
}
