package com.formula.parser;

import com.formula.exception.FormulaParseException;
import com.formula.exception.ParseErrorKind;
import com.formula.lexer.FormulaTokenizer;
import com.formula.lexer.Token;
import com.formula.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenCursor.
 */
class TokenCursorTest {

    private static TokenCursor cursor(String input) {
        return new TokenCursor(new FormulaTokenizer(input).tokenize());
    }

    @Test
    @DisplayName("Should peek without consuming")
    void shouldPeek() {
        TokenCursor cursor = cursor("y ~ x");

        assertEquals(TokenType.IDENT, cursor.peek().type());
        assertEquals(TokenType.TILDE, cursor.peek(1).type());
        assertNull(cursor.peek(3));
        assertEquals(0, cursor.position());
    }

    @Test
    @DisplayName("Should consume on match and expect")
    void shouldConsume() {
        TokenCursor cursor = cursor("y ~ x");

        assertFalse(cursor.match(TokenType.TILDE));
        assertTrue(cursor.match(TokenType.IDENT));
        Token tilde = cursor.expect("~", TokenType.TILDE);

        assertEquals("~", tilde.text());
        assertEquals(2, cursor.position());
    }

    @Test
    @DisplayName("Failed expect should leave position untouched")
    void shouldNotAdvanceOnFailedExpect() {
        TokenCursor cursor = cursor("y x");
        cursor.advance();

        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> cursor.expect("~", TokenType.TILDE));

        assertEquals(ParseErrorKind.UNEXPECTED, e.getKind());
        assertEquals("~", e.getExpected());
        assertEquals("x", e.getFound().text());
        assertEquals(1, e.getPosition());
        assertEquals(1, cursor.position());
    }

    @Test
    @DisplayName("Expect at end of input should report EOI")
    void shouldReportEndOfInput() {
        TokenCursor cursor = cursor("y");
        cursor.advance();

        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> cursor.expect("~", TokenType.TILDE));

        assertEquals(ParseErrorKind.EOI, e.getKind());
        assertNull(e.getFound());
        assertEquals(1, e.getPosition());
        assertEquals(0, e.lastConsumedIndex());
    }

    @Test
    @DisplayName("Trailing operator should not be consumed")
    void shouldNotConsumeTrailingOperator() {
        TokenCursor cursor = cursor("x +");
        cursor.advance();

        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> cursor.matchOperator("term", TokenType.PLUS));

        assertEquals(ParseErrorKind.EOI, e.getKind());
        assertEquals(1, e.getPosition());
        assertEquals(1, cursor.position());
    }

    @Test
    @DisplayName("Operator followed by an operand should be consumed")
    void shouldConsumeOperatorWithOperand() {
        TokenCursor cursor = cursor("x + z");
        cursor.advance();

        assertFalse(cursor.matchOperator("term", TokenType.MINUS));
        assertTrue(cursor.matchOperator("term", TokenType.PLUS));
        assertEquals(2, cursor.position());
    }

    @Test
    @DisplayName("Should rewind to checkpoint")
    void shouldRewind() {
        TokenCursor cursor = cursor("y ~ x + z");
        cursor.advance();
        int mark = cursor.checkpoint();
        cursor.advance();
        cursor.advance();

        cursor.rewind(mark);

        assertEquals(1, cursor.position());
        assertTrue(cursor.check(TokenType.TILDE));
        assertThrows(IllegalArgumentException.class, () -> cursor.rewind(99));
    }

    @Test
    @DisplayName("Should detect end of tokens")
    void shouldDetectEnd() {
        TokenCursor cursor = cursor("y");

        assertFalse(cursor.isAtEnd());
        cursor.advance();
        assertTrue(cursor.isAtEnd());
        assertFalse(cursor.check(TokenType.IDENT));
        assertThrows(FormulaParseException.class, cursor::advance);
    }
}
