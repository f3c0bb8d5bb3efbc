package com.formula.parser;

import com.formula.ast.Argument;
import com.formula.ast.CorrelationType;
import com.formula.ast.GrOption;
import com.formula.ast.Grouping;
import com.formula.ast.RandomEffect;
import com.formula.ast.RandomTerm;
import com.formula.exception.FormulaParseException;
import com.formula.lexer.Token;
import com.formula.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for parenthesized random-effects blocks.
 * <pre>
 * randomEffect := '(' randomTerms ('|' [ID '|'] | '||') grouping ')'
 * randomTerms  := '1' ('+' randomTerm)*
 *               | '0' '+' randomTerm ('+' randomTerm)*
 *               | '-' ('1' | '0')
 *               | randomTerm ('+' randomTerm)* ['-' ('1' | '0')]
 * randomTerm   := (IDENT | functionName '(' argList ')' | 'cs' '(' ('1'|'0'|IDENT) ')'
 *                 | 'mmc' '(' IDENT (',' IDENT)* ')') [(':' | '*') randomTerm]
 * grouping     := IDENT [(':' IDENT) | ('/' IDENT)]
 *               | 'gr' '(' IDENT (',' grOption)* ')'
 *               | 'mm' '(' IDENT (',' IDENT)* ')'
 * </pre>
 */
final class RandomEffectParser {

    private final TokenCursor cursor;

    RandomEffectParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    RandomEffect parse() {
        cursor.expect("(", TokenType.LPAREN);
        List<RandomTerm> terms = parseRandomTerms();

        CorrelationType correlation;
        String correlationId = null;
        if (cursor.match(TokenType.DOUBLE_PIPE)) {
            correlation = new CorrelationType.Uncorrelated();
        } else if (cursor.match(TokenType.PIPE)) {
            if (isCorrelationId()) {
                correlationId = cursor.advance().text();
                if (!cursor.match(TokenType.PIPE)) {
                    throw FormulaParseException.syntax(cursor.position(), "expected second '|' after correlation ID");
                }
                correlation = new CorrelationType.CrossParameter(correlationId);
            } else {
                correlation = new CorrelationType.Correlated();
            }
        } else {
            Token token = cursor.peek();
            if (token == null) {
                throw FormulaParseException.endOfInput(cursor.position(), "| or ||");
            }
            throw FormulaParseException.unexpected(cursor.position(), "| or ||", token);
        }

        Grouping grouping = parseGrouping();
        cursor.expect(")", TokenType.RPAREN);
        return new RandomEffect(terms, grouping, correlation, correlationId);
    }

    private boolean isCorrelationId() {
        if (cursor.check(TokenType.INTEGER, TokenType.ONE, TokenType.ZERO)) {
            return true;
        }
        return cursor.check(TokenType.IDENT) && cursor.checkAt(1, TokenType.PIPE);
    }

    private List<RandomTerm> parseRandomTerms() {
        List<RandomTerm> terms = new ArrayList<>();

        if (cursor.match(TokenType.ONE)) {
            terms.add(new RandomTerm.Intercept());
            while (cursor.matchOperator("random term", TokenType.PLUS)) {
                terms.add(parseRandomTerm());
            }
        } else if (cursor.match(TokenType.ZERO)) {
            if (!cursor.check(TokenType.PLUS)) {
                throw FormulaParseException.syntax(cursor.position(), "expected '+' after '0' in random effects");
            }
            terms.add(new RandomTerm.SuppressIntercept());
            while (cursor.matchOperator("random term", TokenType.PLUS)) {
                terms.add(parseRandomTerm());
            }
        } else if (cursor.check(TokenType.MINUS)) {
            terms.add(parseInterceptSuppression());
        } else {
            terms.add(parseRandomTerm());
            while (cursor.matchOperator("random term", TokenType.PLUS)) {
                terms.add(parseRandomTerm());
            }
            if (cursor.check(TokenType.MINUS)) {
                terms.add(parseInterceptSuppression());
            }
        }
        return terms;
    }

    private RandomTerm parseInterceptSuppression() {
        cursor.matchOperator("'1' or '0'", TokenType.MINUS);
        if (!cursor.match(TokenType.ONE, TokenType.ZERO)) {
            throw FormulaParseException.syntax(cursor.position(),
                    "expected '1' or '0' after '-' for intercept suppression");
        }
        return new RandomTerm.SuppressIntercept();
    }

    private RandomTerm parseRandomTerm() {
        Token token = cursor.peek();
        if (token == null) {
            throw FormulaParseException.endOfInput(cursor.position(), "random term");
        }

        RandomTerm term;
        if (token.type() == TokenType.IDENT) {
            cursor.advance();
            term = new RandomTerm.Column(token.text());
        } else if (token.type() == TokenType.CS) {
            term = parseCs();
        } else if (token.type() == TokenType.MMC) {
            term = parseMmc();
        } else if (token.type().isFunctionName()) {
            cursor.advance();
            cursor.expect("(", TokenType.LPAREN);
            List<Argument> args = ArgumentParser.parseList(cursor);
            ArgumentParser.checkPolyDegree(token.text(), args, cursor.position());
            cursor.expect(")", TokenType.RPAREN);
            term = new RandomTerm.Function(token.text(), args);
        } else {
            throw FormulaParseException.unexpected(cursor.position(), "random term", token);
        }

        if (cursor.matchOperator("random term", TokenType.COLON, TokenType.STAR)) {
            RandomTerm right = parseRandomTerm();
            return new RandomTerm.Interaction(term, right);
        }
        return term;
    }

    private RandomTerm parseCs() {
        cursor.expect("cs", TokenType.CS);
        cursor.expect("(", TokenType.LPAREN);
        Token arg = cursor.expect("1, 0, or column name", TokenType.ONE, TokenType.ZERO, TokenType.IDENT);
        cursor.expect(")", TokenType.RPAREN);

        Argument argument = switch (arg.type()) {
            case ONE -> new Argument.IntLiteral(1);
            case ZERO -> new Argument.IntLiteral(0);
            default -> new Argument.Ident(arg.text());
        };
        return new RandomTerm.Function("cs", List.of(argument));
    }

    private RandomTerm parseMmc() {
        cursor.expect("mmc", TokenType.MMC);
        cursor.expect("(", TokenType.LPAREN);
        List<Argument> args = new ArrayList<>();
        args.add(new Argument.Ident(cursor.expect("column name", TokenType.IDENT).text()));
        while (cursor.matchOperator("column name", TokenType.COMMA)) {
            args.add(new Argument.Ident(cursor.expect("column name", TokenType.IDENT).text()));
        }
        cursor.expect(")", TokenType.RPAREN);
        return new RandomTerm.Function("mmc", args);
    }

    private Grouping parseGrouping() {
        Token token = cursor.expect("grouping variable, gr, or mm", TokenType.IDENT, TokenType.GR, TokenType.MM);

        return switch (token.type()) {
            case GR -> parseGr();
            case MM -> parseMm();
            default -> {
                if (cursor.matchOperator("column name", TokenType.COLON)) {
                    String right = cursor.expect("column name", TokenType.IDENT).text();
                    yield new Grouping.Interaction(token.text(), right);
                }
                if (cursor.matchOperator("column name", TokenType.SLASH)) {
                    String inner = cursor.expect("column name", TokenType.IDENT).text();
                    yield new Grouping.Nested(token.text(), inner);
                }
                yield new Grouping.Simple(token.text());
            }
        };
    }

    private Grouping parseGr() {
        cursor.expect("(", TokenType.LPAREN);
        String group = cursor.expect("column name", TokenType.IDENT).text();
        List<GrOption> options = new ArrayList<>();
        while (cursor.matchOperator("gr option", TokenType.COMMA)) {
            options.add(parseGrOption());
        }
        cursor.expect(")", TokenType.RPAREN);
        return new Grouping.Gr(group, options);
    }

    private GrOption parseGrOption() {
        Token key = cursor.expect("gr option", TokenType.COR, TokenType.ID, TokenType.BY, TokenType.COV, TokenType.DIST);
        cursor.expect("=", TokenType.EQUALS);

        return switch (key.type()) {
            case COR -> new GrOption.Cor(parseBoolean());
            case COV -> new GrOption.Cov(parseBoolean());
            case ID -> new GrOption.Id(parseName("ID string"));
            case DIST -> new GrOption.Dist(parseName("distribution"));
            default -> {
                Token value = cursor.expect("by variable or NULL", TokenType.IDENT, TokenType.NULL);
                yield new GrOption.By(value.type() == TokenType.NULL ? null : value.text());
            }
        };
    }

    private boolean parseBoolean() {
        return cursor.expect("true or false", TokenType.TRUE, TokenType.FALSE).type() == TokenType.TRUE;
    }

    private String parseName(String expected) {
        Token value = cursor.expect(expected, TokenType.IDENT, TokenType.STRING);
        return value.type() == TokenType.STRING ? ArgumentParser.unquote(value.text()) : value.text();
    }

    private Grouping parseMm() {
        cursor.expect("(", TokenType.LPAREN);
        List<String> groups = new ArrayList<>();
        groups.add(cursor.expect("column name", TokenType.IDENT).text());
        while (cursor.matchOperator("column name", TokenType.COMMA)) {
            groups.add(cursor.expect("column name", TokenType.IDENT).text());
        }
        cursor.expect(")", TokenType.RPAREN);
        return new Grouping.Mm(groups);
    }
}
