package com.formula.lexer;

/**
 * Represents a token in a formula.
 *
 * @param type     Token type
 * @param text     Lexeme as it appears in the input
 * @param position Character offset in the input string
 */
public record Token(TokenType type, String text, int position) {

    public boolean isOneOf(TokenType... types) {
        return type.isOneOf(types);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
