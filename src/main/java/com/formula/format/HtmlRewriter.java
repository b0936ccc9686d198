package com.formula.format;

import com.formula.expression.Token;
import com.formula.render.TokenRewriter;

/**
 * Spreadsheet rewriting followed by HTML escaping of the token text.
 * Array delimiters and separators need no escaping and are passed through.
 */
public final class HtmlRewriter extends SpreadsheetTextRewriter {

    public static final HtmlRewriter INSTANCE = new HtmlRewriter();

    @Override
    public TokenRewriter.Rewrite rewrite(String text, Token token) {
        TokenRewriter.Rewrite rewrite = super.rewrite(text, token);
        return rewrite.withText(escape(rewrite.text()));
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
