package com.formula.expression;

import com.formula.exception.UnbalancedStructureException;
import com.formula.expression.BracketStack.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.formula.expression.TokenizerConfig.*;

/**
 * Tokenizer for spreadsheet formulas.
 * <p>
 * A single character scan produces a raw token list which then goes through three passes:
 * <ol>
 *   <li>whitespace between two values becomes an implicit intersection operator, other whitespace is dropped</li>
 *   <li>{@code +} and {@code -} without a preceding value become prefix operators (unary plus is discarded),
 *       and untyped operands are classified as number, logical or range</li>
 *   <li>discarded tokens are removed</li>
 * </ol>
 * Malformed input is tokenized on a best-effort basis. The only failure is a closer without a
 * matching open scope: ')' must close a parenthesis, '}' and the row separator an array.
 */
public final class FormulaTokenizer {

    private static final Logger log = LoggerFactory.getLogger(FormulaTokenizer.class);

    private enum LexState {
        NONE,
        STRING,
        PATH,
        RANGE,
        ERROR
    }

    private final String input;
    private final int length;
    private final boolean listSeparatorIsSemicolon;
    private final char listSeparator;

    private final List<Token> tokens = new ArrayList<>();
    private final BracketStack scopes = new BracketStack();
    private final StringBuilder pending = new StringBuilder();
    private LexState state = LexState.NONE;
    private int pos;

    public FormulaTokenizer(String formula, boolean listSeparatorIsSemicolon) {
        this.input = stripEquals(formula == null ? "" : formula);
        this.length = input.length();
        this.listSeparatorIsSemicolon = listSeparatorIsSemicolon;
        this.listSeparator = listSeparator(listSeparatorIsSemicolon);
        this.pos = 0;
    }

    /**
     * Tokenize a formula.
     *
     * @param formula                  Formula text, with or without the leading '='
     * @param listSeparatorIsSemicolon true for EU separators (';' between arguments)
     * @return Finished token stream
     */
    public static TokenStream tokenize(String formula, boolean listSeparatorIsSemicolon) {
        return new FormulaTokenizer(formula, listSeparatorIsSemicolon).tokenize();
    }

    /**
     * Tokenize the input formula.
     *
     * @return Finished token stream
     * @throws UnbalancedStructureException if a closing bracket has no open scope
     */
    public TokenStream tokenize() {
        scan();
        List<Token> intersected = resolveWhiteSpace(TokenStream.of(tokens));
        List<Token> typed = resolveOperators(intersected);
        List<Token> result = removeNoops(typed);

        log.debug("Tokenized formula of {} chars into {} tokens ({} raw, {} open scopes left)",
                length, result.size(), tokens.size(), scopes.depth());
        return TokenStream.of(result);
    }

    private void scan() {
        while (!isAtEnd()) {
            if (state != LexState.NONE) {
                scanLiteral();
                continue;
            }

            char c = peek();
            int start = pos;

            switch (c) {
                case Operators.QUOTE_DOUBLE -> {
                    flush(TokenType.UNKNOWN);
                    state = LexState.STRING;
                    advance();
                }
                case Operators.QUOTE_SINGLE -> {
                    flush(TokenType.UNKNOWN);
                    state = LexState.PATH;
                    pending.append(advance());
                }
                case Operators.LEFT_BRACKET -> {
                    state = LexState.RANGE;
                    pending.append(advance());
                }
                case Operators.HASH -> {
                    flush(TokenType.UNKNOWN);
                    state = LexState.ERROR;
                    pending.append(advance());
                }
                case Operators.LEFT_BRACE -> {
                    advance();
                    flush(TokenType.UNKNOWN);
                    openScope(Token.of(ARRAY, TokenType.FUNCTION, TokenSubtype.START), Scope.ARRAY);
                    openScope(Token.of(ARRAY_ROW, TokenType.FUNCTION, TokenSubtype.START), Scope.ARRAY_ROW);
                }
                case Operators.RIGHT_BRACE -> {
                    advance();
                    flush(TokenType.OPERAND);
                    tokens.add(closeScope(ARRAY_ROW, Scope.ARRAY_ROW, start));
                    tokens.add(closeScope(ARRAY, Scope.ARRAY, start));
                }
                case Operators.LEFT_PAREN -> {
                    advance();
                    if (pending.length() > 0) {
                        openScope(Token.of(pending.toString(), TokenType.FUNCTION, TokenSubtype.START), Scope.PAREN);
                        pending.setLength(0);
                    } else {
                        openScope(Token.of("", TokenType.SUBEXPRESSION, TokenSubtype.START), Scope.PAREN);
                    }
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    flush(TokenType.OPERAND);
                    tokens.add(closeScope("", Scope.PAREN, start));
                }
                case Operators.PERCENT -> {
                    advance();
                    flush(TokenType.OPERAND);
                    tokens.add(Token.of("%", TokenType.OPERATOR_POSTFIX));
                }
                default -> scanDefault(c, start);
            }
        }

        flush(TokenType.OPERAND);
    }

    private void scanDefault(char c, int start) {
        if (isWhiteSpace(c)) {
            flush(TokenType.OPERAND);
            tokens.add(Token.of("", TokenType.WHITE_SPACE));
            while (!isAtEnd() && isWhiteSpace(peek())) {
                advance();
            }
            return;
        }

        String pair = peekPair();
        if (COMPARISON_OPERATORS.contains(pair)) {
            flush(TokenType.OPERAND);
            tokens.add(Token.of(pair, TokenType.OPERATOR_INFIX, TokenSubtype.LOGICAL));
            pos += 2;
            return;
        }

        if (INFIX_OPERATORS.indexOf(c) >= 0) {
            flush(TokenType.OPERAND);
            tokens.add(Token.of(String.valueOf(advance()), TokenType.OPERATOR_INFIX));
            return;
        }

        if (c == listSeparator) {
            advance();
            flush(TokenType.OPERAND);
            if (scopes.currentType() == TokenType.FUNCTION) {
                tokens.add(Token.of(String.valueOf(c), TokenType.ARGUMENT));
            } else {
                tokens.add(Token.of(String.valueOf(c), TokenType.OPERATOR_INFIX, TokenSubtype.UNION));
            }
            return;
        }

        if (!listSeparatorIsSemicolon && c == Operators.SEMICOLON) {
            // Array row separator
            advance();
            flush(TokenType.OPERAND);
            tokens.add(closeScope(ARRAY_ROW, Scope.ARRAY_ROW, start));
            tokens.add(Token.of(String.valueOf(c), TokenType.ARGUMENT));
            openScope(Token.of(ARRAY_ROW, TokenType.FUNCTION, TokenSubtype.START), Scope.ARRAY_ROW);
            return;
        }

        pending.append(advance());
    }

    /**
     * Consume one character inside a string, quoted path, bracketed range or error literal.
     * Only the terminator of the active state is interpreted.
     */
    private void scanLiteral() {
        char c = peek();
        switch (state) {
            case STRING -> {
                if (c == Operators.QUOTE_DOUBLE) {
                    if (peekNext() == Operators.QUOTE_DOUBLE) {
                        pending.append(Operators.QUOTE_DOUBLE);
                        pos += 2;
                        return;
                    }
                    advance();
                    state = LexState.NONE;
                    tokens.add(Token.of(pending.toString(), TokenType.OPERAND, TokenSubtype.TEXT));
                    pending.setLength(0);
                    return;
                }
                pending.append(advance());
            }
            case PATH -> {
                if (c == Operators.QUOTE_SINGLE) {
                    if (peekNext() == Operators.QUOTE_SINGLE) {
                        pending.append(advance()).append(advance());
                        return;
                    }
                    state = LexState.NONE;
                }
                pending.append(advance());
            }
            case RANGE -> {
                if (c == Operators.RIGHT_BRACKET) {
                    state = LexState.NONE;
                }
                pending.append(advance());
            }
            case ERROR -> {
                pending.append(advance());
                if (ERROR_LITERALS.contains(pending.toString())) {
                    state = LexState.NONE;
                    tokens.add(Token.of(pending.toString(), TokenType.OPERAND, TokenSubtype.ERROR));
                    pending.setLength(0);
                }
            }
            default -> throw new IllegalStateException("Not in a literal: " + state);
        }
    }

    /**
     * Pass 1: whitespace between a value (operand or closed scope) and a value
     * (operand or opened scope) is the intersection operator.
     */
    private static List<Token> resolveWhiteSpace(TokenStream raw) {
        List<Token> result = new ArrayList<>(raw.size());
        TokenCursor cursor = raw.cursor();

        while (cursor.moveNext()) {
            Token token = cursor.current();
            if (token.type() != TokenType.WHITE_SPACE) {
                result.add(token);
                continue;
            }
            if (cursor.isBof() || cursor.isEof()) {
                continue;
            }
            Token previous = cursor.previous();
            Token next = cursor.next();
            if ((previous.isOperand() || previous.isStop()) && (next.isOperand() || next.isStart())) {
                result.add(Token.of("", TokenType.OPERATOR_INFIX, TokenSubtype.INTERSECT));
            }
        }
        return result;
    }

    /**
     * Pass 2: unary sign resolution and operand type inference.
     */
    private static List<Token> resolveOperators(List<Token> input) {
        List<Token> result = new ArrayList<>(input.size());

        for (Token token : input) {
            Token previous = result.isEmpty() ? null : result.get(result.size() - 1);

            if (isSign(token) && !isValue(previous)) {
                token = token.withType(token.value().equals("-") ? TokenType.OPERATOR_PREFIX : TokenType.NOOP);
            }
            if (token.isOperand() && !token.hasSubtype()) {
                token = token.withSubtype(classifyOperand(token.value()));
            }
            result.add(token);
        }
        return result;
    }

    /**
     * Pass 3: drop discarded tokens.
     */
    private static List<Token> removeNoops(List<Token> input) {
        List<Token> result = new ArrayList<>(input.size());
        for (Token token : input) {
            if (token.type() != TokenType.NOOP) {
                result.add(token);
            }
        }
        return result;
    }

    static TokenSubtype classifyOperand(String value) {
        if (NUMBER.matcher(value).matches()) {
            return TokenSubtype.NUMBER;
        }
        if (LOGICAL_VALUES.contains(value.toUpperCase(Locale.ROOT))) {
            return TokenSubtype.LOGICAL;
        }
        return TokenSubtype.RANGE;
    }

    private static boolean isSign(Token token) {
        return token.type() == TokenType.OPERATOR_INFIX
                && (token.value().equals("+") || token.value().equals("-"));
    }

    private static boolean isValue(Token token) {
        return token != null
                && (token.isOperand() || token.isStop() || token.type() == TokenType.OPERATOR_POSTFIX);
    }

    private void openScope(Token start, Scope scope) {
        tokens.add(start);
        scopes.push(start, scope);
    }

    /**
     * Close the innermost scope, which must have been opened by the delimiter matching the closer.
     */
    private Token closeScope(String name, Scope scope, int position) {
        char closer = input.charAt(position);
        if (scopes.isEmpty()) {
            throw error("Unmatched '" + closer + "'", position);
        }
        Scope open = scopes.currentScope();
        if (open != scope) {
            throw error("Unmatched '" + closer + "' inside '" + open.opener() + "'", position);
        }
        return scopes.pop(name, scope);
    }

    private void flush(TokenType type) {
        if (pending.length() > 0) {
            tokens.add(Token.of(pending.toString(), type));
            pending.setLength(0);
        }
    }

    private static String stripEquals(String formula) {
        String trimmed = formula.strip();
        if (!trimmed.isEmpty() && trimmed.charAt(0) == Operators.EQUALS) {
            trimmed = trimmed.substring(1).strip();
        }
        return trimmed;
    }

    private static boolean isWhiteSpace(char c) {
        return c == ' ' || c == '\n' || c == '\r' || c == '\t';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < length ? input.charAt(pos + 1) : '\0';
    }

    private String peekPair() {
        return pos + 1 < length ? input.substring(pos, pos + 2) : "";
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private UnbalancedStructureException error(String message, int position) {
        return new UnbalancedStructureException("Invalid formula at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
