package com.formula.lexer;

import com.formula.exception.FormulaLexException;

import java.util.ArrayList;
import java.util.List;

import static com.formula.lexer.LexerConfig.KEYWORDS;
import static com.formula.lexer.LexerConfig.Operators;

/**
 * Tokenizer for model formulas.
 * Converts input string into a sequence of tokens, failing on the first character
 * sequence that matches no token.
 */
public final class FormulaTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public FormulaTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, without an end marker
     * @throws FormulaLexException on the first unrecognized character sequence
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.TILDE -> tokens.add(single(TokenType.TILDE));
                case Operators.PLUS -> tokens.add(single(TokenType.PLUS));
                case Operators.MINUS -> tokens.add(single(TokenType.MINUS));
                case Operators.STAR -> tokens.add(single(TokenType.STAR));
                case Operators.COLON -> tokens.add(single(TokenType.COLON));
                case Operators.SLASH -> tokens.add(single(TokenType.SLASH));
                case Operators.LEFT_PAREN -> tokens.add(single(TokenType.LPAREN));
                case Operators.RIGHT_PAREN -> tokens.add(single(TokenType.RPAREN));
                case Operators.COMMA -> tokens.add(single(TokenType.COMMA));
                case Operators.EQUALS -> tokens.add(single(TokenType.EQUALS));
                case Operators.PIPE -> {
                    advance();
                    if (match(Operators.PIPE)) {
                        tokens.add(new Token(TokenType.DOUBLE_PIPE, "||", start));
                    } else {
                        tokens.add(new Token(TokenType.PIPE, "|", start));
                    }
                }
                case Operators.QUOTE_DOUBLE -> tokens.add(readString(tokens.size()));
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (isDigit(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw new FormulaLexException(String.valueOf(c), start, tokens.size());
                    }
                }
            }
        }

        return tokens;
    }

    private Token single(TokenType type) {
        int start = pos;
        advance();
        return new Token(type, input.substring(start, pos), start);
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        TokenType keywordType = KEYWORDS.get(text);
        if (keywordType != null) {
            return new Token(keywordType, text, start);
        }

        return new Token(TokenType.IDENT, text, start);
    }

    private Token readNumber() {
        int start = pos;

        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        TokenType type = switch (text) {
            case "1" -> TokenType.ONE;
            case "0" -> TokenType.ZERO;
            default -> TokenType.INTEGER;
        };
        return new Token(type, text, start);
    }

    private Token readString(int tokenIndex) {
        int start = pos;
        advance(); // opening quote

        while (!isAtEnd() && peek() != Operators.QUOTE_DOUBLE) {
            advance();
        }

        if (isAtEnd()) {
            throw new FormulaLexException(input.substring(start), start, tokenIndex);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, input.substring(start, pos), start);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\f';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == Operators.UNDERSCORE;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
