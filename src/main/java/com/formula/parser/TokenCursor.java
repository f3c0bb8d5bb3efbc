package com.formula.parser;

import com.formula.exception.FormulaParseException;
import com.formula.lexer.Token;
import com.formula.lexer.TokenType;

import java.util.List;

/**
 * Rewindable read position over a token list.
 * <p>
 * {@link #expect} and {@link #match} leave the position untouched when they fail, so the
 * position carried by an error always points at the token that could not be consumed.
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int position;

    public TokenCursor(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        this.position = 0;
    }

    public Token peek() {
        return peek(0);
    }

    /**
     * Token at {@code position + offset}, or null past the end.
     */
    public Token peek(int offset) {
        int index = position + offset;
        return index < tokens.size() ? tokens.get(index) : null;
    }

    public boolean check(TokenType... types) {
        return checkAt(0, types);
    }

    public boolean checkAt(int offset, TokenType... types) {
        Token token = peek(offset);
        return token != null && token.isOneOf(types);
    }

    /**
     * Consume the next token if it is one of the given types.
     */
    public boolean match(TokenType... types) {
        if (check(types)) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Consume a binary operator only when an operand token follows it.
     *
     * @param operand   Description of the operand, used when the input ends after the operator
     * @param operators Operator token types
     * @return true if an operator was consumed
     * @throws FormulaParseException (EOI) if the operator is the last token; the operator stays unconsumed
     */
    public boolean matchOperator(String operand, TokenType... operators) {
        if (!check(operators)) {
            return false;
        }
        if (peek(1) == null) {
            throw FormulaParseException.endOfInput(position, operand);
        }
        position++;
        return true;
    }

    /**
     * Consume the next token, which must be one of the given types.
     *
     * @param expected Description used in the error
     * @param types    Accepted token types
     * @return The consumed token
     */
    public Token expect(String expected, TokenType... types) {
        Token token = peek();
        if (token == null) {
            throw FormulaParseException.endOfInput(position, expected);
        }
        if (!token.isOneOf(types)) {
            throw FormulaParseException.unexpected(position, expected, token);
        }
        position++;
        return token;
    }

    /**
     * Consume the next token whatever its type.
     */
    public Token advance() {
        Token token = peek();
        if (token == null) {
            throw FormulaParseException.endOfInput(position, "token");
        }
        position++;
        return token;
    }

    public int checkpoint() {
        return position;
    }

    public void rewind(int checkpoint) {
        if (checkpoint < 0 || checkpoint > tokens.size()) {
            throw new IllegalArgumentException("Invalid checkpoint: " + checkpoint);
        }
        this.position = checkpoint;
    }

    public int position() {
        return position;
    }

    public boolean isAtEnd() {
        return position >= tokens.size();
    }

    public List<Token> tokens() {
        return tokens;
    }
}
