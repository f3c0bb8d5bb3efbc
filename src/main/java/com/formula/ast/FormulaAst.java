package com.formula.ast;

import java.util.List;

/**
 * Result of parsing one formula.
 *
 * @param response     Left-hand side
 * @param terms        Right-hand side terms in formula order
 * @param hasIntercept Whether the model keeps its intercept
 * @param family       Declared family, or null
 */
public record FormulaAst(Response response, List<Term> terms, boolean hasIntercept, Family family) {

    public FormulaAst {
        terms = List.copyOf(terms);
    }
}
