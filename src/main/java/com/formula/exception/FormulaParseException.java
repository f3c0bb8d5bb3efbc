package com.formula.exception;

import com.formula.lexer.Token;

/**
 * Exception thrown when a formula cannot be tokenized or parsed.
 * <p>
 * Carries the cursor position at the moment of failure, i.e. the index of the
 * token that could not be consumed. Tokens {@code [0, position)} were consumed
 * successfully.
 * <p>
 * The index of the last successfully consumed token is {@link #lastConsumedIndex()}, not
 * {@link #getPosition()}: for {@code y ~ x +} the position is 3 and the last consumed
 * token is {@code x} at index 2.
 */
public class FormulaParseException extends FormulaException {

    private final ParseErrorKind kind;
    private final int position;
    private final String expected;
    private final Token found;

    public FormulaParseException(ParseErrorKind kind, String message, int position,
                                 String expected, Token found) {
        super(message);
        this.kind = kind;
        this.position = position;
        this.expected = expected;
        this.found = found;
    }

    public static FormulaParseException endOfInput(int position, String expected) {
        return new FormulaParseException(ParseErrorKind.EOI,
                "Unexpected end of input: expected " + expected, position, expected, null);
    }

    public static FormulaParseException unexpected(int position, String expected, Token found) {
        String actual = found == null ? "end of input" : found.type() + " '" + found.text() + "'";
        return new FormulaParseException(ParseErrorKind.UNEXPECTED,
                "Unexpected token: expected " + expected + ", found " + actual, position, expected, found);
    }

    public static FormulaParseException syntax(int position, String message) {
        return new FormulaParseException(ParseErrorKind.SYNTAX,
                "Invalid syntax: " + message, position, null, null);
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Index of the last token consumed before the failure, or -1 if none was.
     */
    public int lastConsumedIndex() {
        return position - 1;
    }

    /**
     * Description of what the parser expected, for {@link ParseErrorKind#UNEXPECTED} and
     * {@link ParseErrorKind#EOI}; null otherwise.
     */
    public String getExpected() {
        return expected;
    }

    /**
     * The offending token, or null when the input ended.
     */
    public Token getFound() {
        return found;
    }
}
