package com.formula.parser;

import com.formula.ast.Argument;
import com.formula.exception.FormulaParseException;
import com.formula.lexer.Token;
import com.formula.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses function argument lists shared by fixed and random terms.
 * <pre>
 * argList := [] | arg (',' arg)*
 * arg     := IDENT '=' value | value
 * value   := IDENT | INTEGER | STRING | TRUE | FALSE
 * </pre>
 */
final class ArgumentParser {

    /**
     * Largest accepted {@code poly} degree; each degree becomes one generated column.
     */
    static final int MAX_POLY_DEGREE = 100;

    private ArgumentParser() {
    }

    /**
     * Parse arguments up to, but not including, the closing parenthesis.
     */
    static List<Argument> parseList(TokenCursor cursor) {
        List<Argument> args = new ArrayList<>();
        if (cursor.check(TokenType.RPAREN)) {
            return args;
        }

        args.add(parseArgument(cursor));
        while (cursor.matchOperator("argument", TokenType.COMMA)) {
            args.add(parseArgument(cursor));
        }
        return args;
    }

    private static Argument parseArgument(TokenCursor cursor) {
        if (cursor.check(TokenType.IDENT) && cursor.checkAt(1, TokenType.EQUALS)) {
            String name = cursor.advance().text();
            cursor.advance();
            return new Argument.Named(name, parseValue(cursor));
        }
        return parseValue(cursor);
    }

    private static Argument parseValue(TokenCursor cursor) {
        Token token = cursor.peek();
        if (token == null) {
            throw FormulaParseException.endOfInput(cursor.position(), "argument");
        }

        Argument arg = switch (token.type()) {
            case IDENT -> new Argument.Ident(token.text());
            case ONE, ZERO, INTEGER -> new Argument.IntLiteral(parseInteger(cursor, token));
            case STRING -> new Argument.StringLiteral(unquote(token.text()));
            case TRUE -> new Argument.BoolLiteral(true);
            case FALSE -> new Argument.BoolLiteral(false);
            default -> throw FormulaParseException.unexpected(cursor.position(), "argument", token);
        };
        cursor.advance();
        return arg;
    }

    /**
     * Reject a {@code poly} call whose degree lies outside {@code [1, MAX_POLY_DEGREE]}.
     *
     * @param position Cursor position reported on failure
     */
    static void checkPolyDegree(String function, List<Argument> args, int position) {
        if (!"poly".equals(function)) {
            return;
        }
        for (int i = 0; i < args.size(); i++) {
            Argument arg = args.get(i);
            Argument degree = null;
            if (i == 1 && arg instanceof Argument.IntLiteral) {
                degree = arg;
            } else if (arg instanceof Argument.Named named && "degree".equals(named.name())) {
                degree = named.argument();
            }
            if (degree instanceof Argument.IntLiteral literal
                    && (literal.number() < 1 || literal.number() > MAX_POLY_DEGREE)) {
                throw FormulaParseException.syntax(position, "poly() degree must be between 1 and "
                        + MAX_POLY_DEGREE + ", got " + literal.number());
            }
        }
    }

    static int parseInteger(TokenCursor cursor, Token token) {
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw FormulaParseException.syntax(cursor.position(), "integer out of range '" + token.text() + "'");
        }
    }

    static String unquote(String literal) {
        if (literal.length() >= 2 && literal.startsWith("\"") && literal.endsWith("\"")) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }
}
