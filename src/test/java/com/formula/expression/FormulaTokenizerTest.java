package com.formula.expression;

import com.formula.exception.UnbalancedStructureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaTokenizer.
 */
class FormulaTokenizerTest {

    // =====================================================================
    // Operators
    // =====================================================================

    @Test
    @DisplayName("Leading minus is a prefix operator, later plus is infix")
    void leadingMinusIsPrefix() {
        assertTokens("-A1+1",
                Token.of("-", TokenType.OPERATOR_PREFIX),
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("+", TokenType.OPERATOR_INFIX),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER));
    }

    @Test
    @DisplayName("Minus after an operator is a prefix operator")
    void minusAfterOperatorIsPrefix() {
        assertTokens("=1--2",
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("-", TokenType.OPERATOR_INFIX),
                Token.of("-", TokenType.OPERATOR_PREFIX),
                Token.of("2", TokenType.OPERAND, TokenSubtype.NUMBER));
    }

    @Test
    @DisplayName("Unary plus is discarded")
    void unaryPlusIsDiscarded() {
        assertTokens("=+A1",
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE));
        assertTokens("=SUM(+-1)",
                Token.of("SUM", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("-", TokenType.OPERATOR_PREFIX),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    @Test
    @DisplayName("Minus after a closing parenthesis or postfix operator is infix")
    void minusAfterValueIsInfix() {
        assertTokens("=(1)-2",
                Token.of("", TokenType.SUBEXPRESSION, TokenSubtype.START),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("", TokenType.SUBEXPRESSION, TokenSubtype.STOP),
                Token.of("-", TokenType.OPERATOR_INFIX),
                Token.of("2", TokenType.OPERAND, TokenSubtype.NUMBER));
        assertTokens("=5%-1",
                Token.of("5", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("%", TokenType.OPERATOR_POSTFIX),
                Token.of("-", TokenType.OPERATOR_INFIX),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER));
    }

    @Test
    @DisplayName("Two-character comparisons are matched before single characters")
    void twoCharacterComparisons() {
        assertTokens("=A1<>B1",
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("<>", TokenType.OPERATOR_INFIX, TokenSubtype.LOGICAL),
                Token.of("B1", TokenType.OPERAND, TokenSubtype.RANGE));
        assertTokens("=A1>=1",
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of(">=", TokenType.OPERATOR_INFIX, TokenSubtype.LOGICAL),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER));
        assertTokens("=A1<2",
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("<", TokenType.OPERATOR_INFIX),
                Token.of("2", TokenType.OPERAND, TokenSubtype.NUMBER));
    }

    // =====================================================================
    // Literals
    // =====================================================================

    @Test
    @DisplayName("Doubled quote inside a string is one literal quote")
    void doubledQuoteInString() {
        assertTokens("=\"a\"\"b\"",
                Token.of("a\"b", TokenType.OPERAND, TokenSubtype.TEXT));
    }

    @Test
    @DisplayName("Operators and separators inside a string are literal")
    void operatorsInsideString() {
        assertTokens("=\"a,b(c)+#N/A\"",
                Token.of("a,b(c)+#N/A", TokenType.OPERAND, TokenSubtype.TEXT));
    }

    @Test
    @DisplayName("Empty string is a text operand")
    void emptyString() {
        assertTokens("=A1=\"\"",
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("=", TokenType.OPERATOR_INFIX),
                Token.of("", TokenType.OPERAND, TokenSubtype.TEXT));
    }

    @Test
    @DisplayName("Error literal ends when it matches a known error")
    void errorLiteral() {
        assertTokens("=#N/A+1",
                Token.of("#N/A", TokenType.OPERAND, TokenSubtype.ERROR),
                Token.of("+", TokenType.OPERATOR_INFIX),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER));
        assertTokens("=IF(#DIV/0!,1)",
                Token.of("IF", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("#DIV/0!", TokenType.OPERAND, TokenSubtype.ERROR),
                Token.of(",", TokenType.ARGUMENT),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    @Test
    @DisplayName("Quoted sheet path keeps its quotes and continues into the reference")
    void quotedPath() {
        assertTokens("='My Sheet'!A1",
                Token.of("'My Sheet'!A1", TokenType.OPERAND, TokenSubtype.RANGE));
        assertTokens("='It''s'!A1",
                Token.of("'It''s'!A1", TokenType.OPERAND, TokenSubtype.RANGE));
    }

    @Test
    @DisplayName("Bracketed references stay one operand")
    void bracketedReferences() {
        assertTokens("=[Status]@row",
                Token.of("[Status]@row", TokenType.OPERAND, TokenSubtype.RANGE));
        assertTokens("=SUM(Table1[Col 1])",
                Token.of("SUM", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("Table1[Col 1]", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    @Test
    @DisplayName("Operands are classified as number, logical or range")
    void operandClassification() {
        assertEquals(TokenSubtype.NUMBER, FormulaTokenizer.classifyOperand("42"));
        assertEquals(TokenSubtype.NUMBER, FormulaTokenizer.classifyOperand("1.5"));
        assertEquals(TokenSubtype.NUMBER, FormulaTokenizer.classifyOperand(".5"));
        assertEquals(TokenSubtype.NUMBER, FormulaTokenizer.classifyOperand("1e3"));
        assertEquals(TokenSubtype.LOGICAL, FormulaTokenizer.classifyOperand("TRUE"));
        assertEquals(TokenSubtype.LOGICAL, FormulaTokenizer.classifyOperand("false"));
        assertEquals(TokenSubtype.RANGE, FormulaTokenizer.classifyOperand("A1:B2"));
        assertEquals(TokenSubtype.RANGE, FormulaTokenizer.classifyOperand("Infinity"));
        assertEquals(TokenSubtype.RANGE, FormulaTokenizer.classifyOperand("0x10"));
    }

    // =====================================================================
    // Separators
    // =====================================================================

    @Test
    @DisplayName("Comma separates arguments in US mode")
    void commaSeparatesArgumentsInUsMode() {
        assertTokens(FormulaTokenizer.tokenize("=SUM(A,B)", false),
                Token.of("SUM", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("A", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of(",", TokenType.ARGUMENT),
                Token.of("B", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    @Test
    @DisplayName("Semicolon separates arguments in EU mode")
    void semicolonSeparatesArgumentsInEuMode() {
        assertTokens(FormulaTokenizer.tokenize("=SUM(A;B)", true),
                Token.of("SUM", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("A", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of(";", TokenType.ARGUMENT),
                Token.of("B", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    @Test
    @DisplayName("List separator outside a function is the union operator")
    void unionOutsideFunction() {
        assertTokens("=A1,B1",
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of(",", TokenType.OPERATOR_INFIX, TokenSubtype.UNION),
                Token.of("B1", TokenType.OPERAND, TokenSubtype.RANGE));
        assertTokens("=SUM((A1,B1))",
                Token.of("SUM", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("", TokenType.SUBEXPRESSION, TokenSubtype.START),
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of(",", TokenType.OPERATOR_INFIX, TokenSubtype.UNION),
                Token.of("B1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("", TokenType.SUBEXPRESSION, TokenSubtype.STOP),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    @Test
    @DisplayName("Array literal opens array and row scopes, semicolon starts a new row")
    void arrayLiteral() {
        assertTokens("={1,2;3,4}",
                Token.of("ARRAY", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("ARRAYROW", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of(",", TokenType.ARGUMENT),
                Token.of("2", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("ARRAYROW", TokenType.FUNCTION, TokenSubtype.STOP),
                Token.of(";", TokenType.ARGUMENT),
                Token.of("ARRAYROW", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("3", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of(",", TokenType.ARGUMENT),
                Token.of("4", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("ARRAYROW", TokenType.FUNCTION, TokenSubtype.STOP),
                Token.of("ARRAY", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    // =====================================================================
    // Whitespace
    // =====================================================================

    @Test
    @DisplayName("Space between two references is the intersection operator")
    void spaceIsIntersection() {
        assertTokens("=A1:B5 B2:C6",
                Token.of("A1:B5", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("", TokenType.OPERATOR_INFIX, TokenSubtype.INTERSECT),
                Token.of("B2:C6", TokenType.OPERAND, TokenSubtype.RANGE));
    }

    @Test
    @DisplayName("Space after a closed scope and before a function is the intersection operator")
    void spaceBetweenScopesIsIntersection() {
        assertTokens("=(A1) INDEX(B1)",
                Token.of("", TokenType.SUBEXPRESSION, TokenSubtype.START),
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("", TokenType.SUBEXPRESSION, TokenSubtype.STOP),
                Token.of("", TokenType.OPERATOR_INFIX, TokenSubtype.INTERSECT),
                Token.of("INDEX", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("B1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    @Test
    @DisplayName("Other whitespace is dropped")
    void layoutWhitespaceIsDropped() {
        assertTokens("= SUM( A1 ,\n\tB1 ) + 1 ",
                Token.of("SUM", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("A1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of(",", TokenType.ARGUMENT),
                Token.of("B1", TokenType.OPERAND, TokenSubtype.RANGE),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP),
                Token.of("+", TokenType.OPERATOR_INFIX),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER));
    }

    @ParameterizedTest
    @DisplayName("Finished stream has no whitespace or discarded tokens and every operand is typed")
    @ValueSource(strings = {
            "= 1 +  + 2",
            "=SUM(A1 B1, +C1)",
            "=\"x\" & \"y\"",
            "={1, 2 ; 3}",
            "=IF(A1 > 0 , TRUE , #N/A)"
    })
    void finishedStreamIsClean(String formula) {
        TokenStream stream = FormulaTokenizer.tokenize(formula, false);
        for (Token token : stream) {
            assertNotEquals(TokenType.WHITE_SPACE, token.type());
            assertNotEquals(TokenType.NOOP, token.type());
            if (token.isOperand()) {
                assertTrue(token.hasSubtype(), "Untyped operand " + token);
            }
        }
    }

    // =====================================================================
    // Structure
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Balanced formulas have matching start and stop tokens with non-negative depth")
    @ValueSource(strings = {
            "=IF(A1>5,SUM(B1:B5),0)",
            "=ROUND((A1+B1)*50%,2)",
            "={1,2;3,4}",
            "=IFERROR(VLOOKUP(A1,'Data'!A:B,2,FALSE),\"\")",
            "=((1))"
    })
    void balancedFormulasAreWellBracketed(String formula) {
        TokenStream stream = FormulaTokenizer.tokenize(formula, false);
        int depth = 0;
        int starts = 0;
        int stops = 0;
        for (Token token : stream) {
            if (token.isStart()) {
                depth++;
                starts++;
            } else if (token.isStop()) {
                depth--;
                stops++;
            }
            assertTrue(depth >= 0, "Negative depth at " + token);
        }
        assertEquals(starts, stops);
    }

    @Test
    @DisplayName("Extra closing parenthesis fails with its position")
    void extraClosingParenthesisFails() {
        UnbalancedStructureException e = assertThrows(UnbalancedStructureException.class,
                () -> FormulaTokenizer.tokenize("=SUM(A1))", false));
        assertEquals(7, e.getPosition());
        assertTrue(e.getMessage().contains("SUM(A1))"));
    }

    @Test
    @DisplayName("Closing brace or row separator without an array fails")
    void strayArrayDelimitersFail() {
        assertThrows(UnbalancedStructureException.class, () -> FormulaTokenizer.tokenize("=1}", false));
        assertThrows(UnbalancedStructureException.class, () -> FormulaTokenizer.tokenize("=1;2", false));
    }

    @ParameterizedTest
    @DisplayName("Closer that belongs to another kind of scope fails with its position")
    @CsvSource(delimiter = '|', value = {
            "=SUM((1}   | 6",
            "=(1;2)     | 2",
            "={1,2)     | 4",
            "=SUM(1;2)  | 5",
            "={(1}      | 3"
    })
    void mismatchedCloserFails(String formula, int position) {
        UnbalancedStructureException e = assertThrows(UnbalancedStructureException.class,
                () -> FormulaTokenizer.tokenize(formula, false));
        assertEquals(position, e.getPosition());
        assertTrue(e.getMessage().contains("inside"), e.getMessage());
    }

    @Test
    @DisplayName("Array closers stay paired with array openers inside functions")
    void arrayInsideFunction() {
        assertTokens("=SUM({1;2},3)",
                Token.of("SUM", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("ARRAY", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("ARRAYROW", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("1", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("ARRAYROW", TokenType.FUNCTION, TokenSubtype.STOP),
                Token.of(";", TokenType.ARGUMENT),
                Token.of("ARRAYROW", TokenType.FUNCTION, TokenSubtype.START),
                Token.of("2", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("ARRAYROW", TokenType.FUNCTION, TokenSubtype.STOP),
                Token.of("ARRAY", TokenType.FUNCTION, TokenSubtype.STOP),
                Token.of(",", TokenType.ARGUMENT),
                Token.of("3", TokenType.OPERAND, TokenSubtype.NUMBER),
                Token.of("", TokenType.FUNCTION, TokenSubtype.STOP));
    }

    @Test
    @DisplayName("Unclosed scopes are tolerated")
    void unclosedScopeIsTolerated() {
        TokenStream stream = FormulaTokenizer.tokenize("=SUM(A1", false);
        assertEquals(1, stream.count(TokenType.FUNCTION, TokenSubtype.START));
        assertEquals(0, stream.count(TokenType.FUNCTION, TokenSubtype.STOP));
    }

    // =====================================================================
    // Best effort
    // =====================================================================

    @Test
    @DisplayName("Unterminated string and error literal become operands")
    void unterminatedLiterals() {
        assertTokens("=\"abc",
                Token.of("abc", TokenType.OPERAND, TokenSubtype.RANGE));
        assertTokens("=#FOO",
                Token.of("#FOO", TokenType.OPERAND, TokenSubtype.RANGE));
    }

    @Test
    @DisplayName("Text directly before a string is kept as an unknown token")
    void pendingTextBeforeString() {
        assertTokens("=A1\"x\"",
                Token.of("A1", TokenType.UNKNOWN),
                Token.of("x", TokenType.OPERAND, TokenSubtype.TEXT));
    }

    @Test
    @DisplayName("Empty formulas produce an empty stream")
    void emptyFormula() {
        assertTrue(FormulaTokenizer.tokenize("=", false).isEmpty());
        assertTrue(FormulaTokenizer.tokenize("   ", false).isEmpty());
        assertTrue(FormulaTokenizer.tokenize(null, false).isEmpty());
    }

    // =====================================================================
    // Helper Methods
    // =====================================================================

    private static void assertTokens(String formula, Token... expected) {
        assertTokens(FormulaTokenizer.tokenize(formula, false), expected);
    }

    private static void assertTokens(TokenStream stream, Token... expected) {
        assertEquals(List.of(expected), stream.tokens(), () -> "Tokens: " + stream);
    }
}
