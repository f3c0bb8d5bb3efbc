package com.formula.core;

import com.formula.exception.FormulaParseException;
import com.formula.meta.FormulaMetaData;

import java.util.List;

/**
 * Parses model formulas into metadata documents.
 * <p>
 * Implementations keep no state between calls and may be shared across threads.
 */
public interface FormulaEngine {

    /**
     * Run the full pipeline: tokenize, parse and analyze.
     *
     * @param formula Formula text, e.g. {@code y ~ x + poly(x, 2) + (x || group)}
     * @return Metadata document
     * @throws FormulaParseException on the first lexing or grammar error
     */
    FormulaMetaData parse(String formula);

    /**
     * Tokenize only.
     *
     * @param formula Formula text
     * @return Tokens in input order
     * @throws com.formula.exception.FormulaLexException on the first unrecognized character sequence
     */
    List<LexedToken> lex(String formula);
}
