package com.formula.lexer;

import java.util.Map;

/**
 * Keyword table and operator characters of the formula language.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /**
     * Keywords mapped to token types. Matching is exact and case sensitive; a keyword
     * always wins over the generic identifier class.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            // Literals
            Map.entry("true", TokenType.TRUE),
            Map.entry("TRUE", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("FALSE", TokenType.FALSE),
            Map.entry("null", TokenType.NULL),
            Map.entry("NULL", TokenType.NULL),

            // Transformations
            Map.entry("poly", TokenType.POLY),
            Map.entry("log", TokenType.LOG),
            Map.entry("scale", TokenType.SCALE),
            Map.entry("center", TokenType.CENTER),
            Map.entry("standardize", TokenType.STANDARDIZE),
            Map.entry("bs", TokenType.BS),
            Map.entry("gp", TokenType.GP),
            Map.entry("mono", TokenType.MONO),
            Map.entry("me", TokenType.ME),
            Map.entry("mi", TokenType.MI),
            Map.entry("forward_fill", TokenType.FORWARD_FILL),
            Map.entry("backward_fill", TokenType.BACKWARD_FILL),
            Map.entry("diff", TokenType.DIFF),
            Map.entry("lag", TokenType.LAG),
            Map.entry("lead", TokenType.LEAD),
            Map.entry("trunc", TokenType.TRUNC),
            Map.entry("weights", TokenType.WEIGHTS),
            Map.entry("trials", TokenType.TRIALS),
            Map.entry("cens", TokenType.CENS),
            Map.entry("offset", TokenType.OFFSET),
            Map.entry("factor", TokenType.FACTOR),
            Map.entry("c", TokenType.C),
            Map.entry("bind", TokenType.BIND),

            // Random effects
            Map.entry("gr", TokenType.GR),
            Map.entry("mm", TokenType.MM),
            Map.entry("mmc", TokenType.MMC),
            Map.entry("cs", TokenType.CS),
            Map.entry("cor", TokenType.COR),
            Map.entry("id", TokenType.ID),
            Map.entry("by", TokenType.BY),
            Map.entry("cov", TokenType.COV),
            Map.entry("dist", TokenType.DIST),

            // Families
            Map.entry("family", TokenType.FAMILY),
            Map.entry("gaussian", TokenType.GAUSSIAN),
            Map.entry("binomial", TokenType.BINOMIAL),
            Map.entry("poisson", TokenType.POISSON)
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char TILDE = '~';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char COLON = ':';
        public static final char SLASH = '/';
        public static final char PIPE = '|';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char COMMA = ',';
        public static final char EQUALS = '=';
        public static final char QUOTE_DOUBLE = '"';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
