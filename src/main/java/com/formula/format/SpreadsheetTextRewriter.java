package com.formula.format;

import com.formula.expression.Token;
import com.formula.expression.TokenCursor;
import com.formula.expression.TokenStream;
import com.formula.expression.TokenSubtype;
import com.formula.expression.TokenType;
import com.formula.expression.TokenizerConfig;
import com.formula.render.TokenRewriter;

/**
 * Restores spreadsheet syntax that tokenizing removed: doubled quotes inside
 * text operands, the space that stands for the intersection operator and the
 * braces of array literals. Output rendered with this rewriter tokenizes back
 * to the same structure.
 * <p>
 * Array literals are written on one line: the opening brace takes the token's
 * indentation, row scopes and separators are emitted as they are.
 */
public class SpreadsheetTextRewriter implements TokenRewriter {

    public static final SpreadsheetTextRewriter INSTANCE = new SpreadsheetTextRewriter();

    @Override
    public Rewrite rewrite(String text, Token token) {
        if (token.isOperand() && token.subtype() == TokenSubtype.TEXT) {
            return Rewrite.template(text.replace("\"", "\"\""));
        }
        if (token.type() == TokenType.OPERATOR_INFIX && token.subtype() == TokenSubtype.INTERSECT) {
            return Rewrite.template(" ");
        }
        return Rewrite.template(text);
    }

    @Override
    public Rewrite rewrite(String text, Token token, TokenCursor cursor) {
        TokenStream stream = cursor.stream();
        int index = cursor.index();

        if (token.type() == TokenType.FUNCTION && isArrayScope(stream, index)) {
            if (TokenizerConfig.ARRAY.equals(token.value())) {
                return token.isStart() ? Rewrite.indentedLiteral("{") : Rewrite.literal("}");
            }
            return Rewrite.literal("");
        }
        if (token.type() == TokenType.ARGUMENT) {
            int scope = stream.enclosingStart(index);
            if (scope >= 0 && isArrayScope(stream, scope)) {
                return Rewrite.literal(text);
            }
        }
        return rewrite(text, token);
    }

    /**
     * Whether the function token at {@code index} belongs to an array literal rather than
     * to a function that happens to share the name. Array scopes are closed by STOP tokens
     * carrying the scope name; ')' closes with an empty value.
     */
    static boolean isArrayScope(TokenStream stream, int index) {
        Token token = stream.get(index);
        String name = token.value();
        if (token.type() != TokenType.FUNCTION
                || !(TokenizerConfig.ARRAY.equals(name) || TokenizerConfig.ARRAY_ROW.equals(name))) {
            return false;
        }
        if (token.isStop()) {
            return true;
        }

        int stop = stream.matchingStop(index);
        if (stop >= 0) {
            return name.equals(stream.get(stop).value());
        }

        // Unclosed at end of input
        if (TokenizerConfig.ARRAY.equals(name)) {
            return index + 1 < stream.size()
                    && stream.get(index + 1).isStart()
                    && TokenizerConfig.ARRAY_ROW.equals(stream.get(index + 1).value());
        }
        int outer = stream.enclosingStart(index);
        return outer >= 0
                && TokenizerConfig.ARRAY.equals(stream.get(outer).value())
                && isArrayScope(stream, outer);
    }
}
