package com.formula.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.formula.lexer.Token;

/**
 * One token of a lexed formula as exposed to tooling.
 *
 * @param token  Token kind, e.g. {@code TILDE}
 * @param lexeme Matched input text
 */
@JsonPropertyOrder({"token", "lexeme"})
public record LexedToken(@JsonProperty("token") String token, @JsonProperty("lexeme") String lexeme) {

    public static LexedToken of(Token token) {
        return new LexedToken(token.type().name(), token.text());
    }
}
