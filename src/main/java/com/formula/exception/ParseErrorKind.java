package com.formula.exception;

/**
 * Categories of formula parse failures.
 */
public enum ParseErrorKind {
    /** Input contains a character sequence that matches no token. */
    LEX,
    /** Input ended where another token was required. */
    EOI,
    /** A token is present but of the wrong kind. */
    UNEXPECTED,
    /** Tokens are well formed but violate a grammar rule. */
    SYNTAX
}
