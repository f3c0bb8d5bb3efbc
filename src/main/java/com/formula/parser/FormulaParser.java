package com.formula.parser;

import com.formula.ast.Argument;
import com.formula.ast.Family;
import com.formula.ast.FormulaAst;
import com.formula.ast.Response;
import com.formula.ast.Term;
import com.formula.exception.FormulaParseException;
import com.formula.lexer.Token;
import com.formula.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for model formulas.
 * Converts tokens into a {@link FormulaAst} using recursive descent parsing.
 * <p>
 * Grammar:
 * <pre>
 * formula  := response '~' rhs [',' 'family' '=' familyName]
 * response := IDENT | 'bind' '(' IDENT (',' IDENT)+ ')'
 * rhs      := [term] ('+' term)* ['-' '1']
 * term     := atom ((':' | '*') term)*
 * atom     := IDENT | functionName '(' argList ')' | '1' | '0'
 *           | '(' randomEffectBody ')' | '(' term ')'
 * </pre>
 * The leading term may only be omitted when the right-hand side starts with {@code -}.
 */
public final class FormulaParser {

    private final String input;
    private final TokenCursor cursor;
    private final RandomEffectParser randomEffectParser;

    public FormulaParser(String input, List<Token> tokens) {
        this.input = input;
        this.cursor = new TokenCursor(tokens);
        this.randomEffectParser = new RandomEffectParser(cursor);
    }

    /**
     * Parse the token stream into a formula tree.
     *
     * @return Parsed formula
     * @throws FormulaParseException on the first grammar violation
     */
    public FormulaAst parse() {
        Response response = parseResponse();
        cursor.expect("~", TokenType.TILDE);

        List<Term> terms = new ArrayList<>();
        boolean interceptRemoved = parseRhs(terms);

        Family family = null;
        if (cursor.matchOperator("family", TokenType.COMMA)) {
            cursor.expect("family", TokenType.FAMILY);
            cursor.expect("=", TokenType.EQUALS);
            family = parseFamily();
        }

        if (!cursor.isAtEnd()) {
            throw FormulaParseException.unexpected(cursor.position(), "end of formula", cursor.peek());
        }

        boolean explicitIntercept = terms.stream().anyMatch(t -> t instanceof Term.Intercept);
        boolean zero = terms.stream().anyMatch(t -> t instanceof Term.Zero);
        if (explicitIntercept && (zero || interceptRemoved)) {
            throw FormulaParseException.syntax(cursor.position(),
                    "explicit intercept '1' cannot be combined with '0' or '- 1' in '" + input + "'");
        }

        return new FormulaAst(response, terms, !(zero || interceptRemoved), family);
    }

    /**
     * Cursor position, i.e. the number of tokens consumed so far.
     */
    public int position() {
        return cursor.position();
    }

    private Response parseResponse() {
        Token token = cursor.expect("column name or bind", TokenType.IDENT, TokenType.BIND);
        if (token.type() == TokenType.IDENT) {
            return new Response.Single(token.text());
        }

        cursor.expect("(", TokenType.LPAREN);
        List<String> names = new ArrayList<>();
        if (!cursor.check(TokenType.RPAREN)) {
            names.add(cursor.expect("column name", TokenType.IDENT).text());
            while (cursor.matchOperator("column name", TokenType.COMMA)) {
                names.add(cursor.expect("column name", TokenType.IDENT).text());
            }
        }
        cursor.expect(")", TokenType.RPAREN);

        if (names.size() < 2) {
            throw FormulaParseException.syntax(cursor.position(), "bind() requires at least 2 variables");
        }
        return new Response.Multivariate(names);
    }

    /**
     * Parse the right-hand side into {@code terms}.
     *
     * @return true if the intercept was removed with {@code - 1}
     */
    private boolean parseRhs(List<Term> terms) {
        if (!cursor.check(TokenType.MINUS)) {
            terms.add(parseTerm());
        }
        while (cursor.matchOperator("term", TokenType.PLUS)) {
            terms.add(parseTerm());
        }

        if (cursor.matchOperator("'1'", TokenType.MINUS)) {
            if (!cursor.match(TokenType.ONE)) {
                throw FormulaParseException.syntax(cursor.position(), "expected '1' after '-' to remove intercept");
            }
            return true;
        }
        return false;
    }

    private Term parseTerm() {
        Term term = parseAtom();
        if (term instanceof Term.RandomEffectTerm || term instanceof Term.Intercept || term instanceof Term.Zero) {
            return term;
        }

        while (cursor.matchOperator("term", TokenType.COLON, TokenType.STAR)) {
            if (cursor.check(TokenType.LPAREN, TokenType.ONE, TokenType.ZERO)) {
                throw FormulaParseException.unexpected(cursor.position(), "column or function call", cursor.peek());
            }
            Term right = parseTerm();
            term = new Term.Interaction(term, right);
        }
        return term;
    }

    private Term parseAtom() {
        Token token = cursor.peek();
        if (token == null) {
            throw FormulaParseException.endOfInput(cursor.position(), "term");
        }

        if (token.type() == TokenType.LPAREN) {
            if (looksLikeRandomEffect()) {
                return new Term.RandomEffectTerm(randomEffectParser.parse());
            }
            cursor.advance();
            Term inner = parseTerm();
            cursor.expect(")", TokenType.RPAREN);
            return inner;
        }

        if (token.type() == TokenType.ONE) {
            cursor.advance();
            return new Term.Intercept();
        }
        if (token.type() == TokenType.ZERO) {
            cursor.advance();
            return new Term.Zero();
        }

        if (token.type() == TokenType.IDENT || token.type().isFunctionName()) {
            cursor.advance();
            if (cursor.match(TokenType.LPAREN)) {
                List<Argument> args = ArgumentParser.parseList(cursor);
                ArgumentParser.checkPolyDegree(token.text(), args, cursor.position());
                cursor.expect(")", TokenType.RPAREN);
                return new Term.Function(token.text(), args);
            }
            if (token.type() == TokenType.IDENT) {
                return new Term.Column(token.text());
            }
            throw FormulaParseException.syntax(cursor.position(), "expected '(' after '" + token.text() + "'");
        }

        throw FormulaParseException.unexpected(cursor.position(), "term", token);
    }

    /**
     * Decide, without consuming anything, whether the {@code (} under the cursor opens a
     * random-effects block: it does when followed by {@code 1}, {@code 0} or {@code -}, or when
     * a bar appears before the matching {@code )}.
     */
    private boolean looksLikeRandomEffect() {
        int mark = cursor.checkpoint();
        try {
            if (cursor.checkAt(1, TokenType.ONE, TokenType.ZERO, TokenType.MINUS)) {
                return true;
            }
            int depth = 0;
            for (int offset = 1; cursor.peek(offset) != null; offset++) {
                TokenType type = cursor.peek(offset).type();
                if (type == TokenType.LPAREN) {
                    depth++;
                } else if (type == TokenType.RPAREN) {
                    if (depth == 0) {
                        return false;
                    }
                    depth--;
                } else if (depth == 0 && type.isOneOf(TokenType.PIPE, TokenType.DOUBLE_PIPE)) {
                    return true;
                }
            }
            return false;
        } finally {
            cursor.rewind(mark);
        }
    }

    private Family parseFamily() {
        Token token = cursor.expect("gaussian | binomial | poisson",
                TokenType.GAUSSIAN, TokenType.BINOMIAL, TokenType.POISSON);
        return Family.valueOf(token.type().name());
    }
}
