package com.formula;

import com.formula.core.DefaultFormulaEngine;
import com.formula.core.FormulaEngine;
import com.formula.core.LexedToken;
import com.formula.meta.FormulaMetaData;

import java.util.List;

/**
 * Static entry points for parsing formulas with the default configuration.
 * <pre>
 * FormulaMetaData meta = Formulas.parseFormula("y ~ x + poly(x, 2) + (x || group)");
 * meta.allGeneratedColumns(); // [y, intercept, x, x_poly_1, x_poly_2, group]
 * </pre>
 */
public final class Formulas {

    private static final FormulaEngine ENGINE = new DefaultFormulaEngine();

    private Formulas() {
    }

    /**
     * Parse a formula into its metadata document.
     *
     * @param formula Formula text
     * @return Metadata document
     * @throws com.formula.exception.FormulaParseException on invalid input
     */
    public static FormulaMetaData parseFormula(String formula) {
        return ENGINE.parse(formula);
    }

    /**
     * Tokenize a formula.
     *
     * @param formula Formula text
     * @return Tokens with their lexemes
     * @throws com.formula.exception.FormulaLexException on invalid input
     */
    public static List<LexedToken> lexFormula(String formula) {
        return ENGINE.lex(formula);
    }
}
