package com.formula.diagnostics;

import com.formula.exception.FormulaLexException;
import com.formula.exception.FormulaParseException;
import com.formula.lexer.FormulaTokenizer;
import com.formula.lexer.Token;

import java.util.List;

/**
 * Renders parse errors as plain text, showing the consumed prefix of the formula
 * and the token that could not be consumed:
 * <pre>
 * Syntax error - unexpected token
 * Formula: y ~ x + )
 * Show: y ~ x + )
 * Expected: term
 * </pre>
 */
public final class ParseErrorFormatter {

    static final String END_OF_INPUT = "<eoi>";

    private ParseErrorFormatter() {
    }

    /**
     * Format an error using the lexemes of the formula it was raised for.
     *
     * @param formula  Formula text
     * @param position Cursor position at the failure
     * @param lexemes  Lexemes of the formula in order
     * @param error    The error
     * @return Multi-line message ending with a newline
     */
    public static String format(String formula, int position, List<String> lexemes, FormulaParseException error) {
        int consumed = Math.max(0, Math.min(position, lexemes.size()));

        StringBuilder out = new StringBuilder();
        out.append(heading(error)).append('\n');
        out.append("Formula: ").append(formula).append('\n');

        out.append("Show: ");
        for (int i = 0; i < consumed; i++) {
            out.append(lexemes.get(i)).append(' ');
        }
        out.append(failing(error, consumed, lexemes)).append('\n');

        if (error.getExpected() != null) {
            out.append("Expected: ").append(error.getExpected()).append('\n');
        } else {
            out.append("Detail: ").append(error.getMessage()).append('\n');
        }
        return out.toString();
    }

    /**
     * Format an error, re-lexing the formula to recover its lexemes.
     */
    public static String format(String formula, FormulaParseException error) {
        String lexable = error instanceof FormulaLexException lex ? prefix(formula, lex.getOffset()) : formula;
        List<Token> tokens;
        try {
            tokens = new FormulaTokenizer(lexable).tokenize();
        } catch (FormulaLexException e) {
            // errors raised before tokenizing, e.g. the length limit
            tokens = new FormulaTokenizer(prefix(lexable, e.getOffset())).tokenize();
        }
        List<String> lexemes = tokens.stream()
                .map(Token::text)
                .toList();
        return format(formula, error.getPosition(), lexemes, error);
    }

    private static String prefix(String text, int offset) {
        return text.substring(0, Math.min(offset, text.length()));
    }

    private static String heading(FormulaParseException error) {
        return switch (error.getKind()) {
            case LEX -> "Lexing error";
            case EOI -> "Unexpected end of input";
            case UNEXPECTED -> "Syntax error - unexpected token";
            case SYNTAX -> "Syntax error";
        };
    }

    private static String failing(FormulaParseException error, int consumed, List<String> lexemes) {
        if (error instanceof FormulaLexException lex) {
            return lex.getSlice();
        }
        return consumed < lexemes.size() ? lexemes.get(consumed) : END_OF_INPUT;
    }
}
