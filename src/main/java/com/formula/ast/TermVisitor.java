package com.formula.ast;

/**
 * Visitor over every {@link Term} kind.
 */
public interface TermVisitor<R> {

    R visitColumn(Term.Column column);

    R visitFunction(Term.Function function);

    R visitInteraction(Term.Interaction interaction);

    R visitRandomEffect(Term.RandomEffectTerm randomEffect);

    R visitIntercept(Term.Intercept intercept);

    R visitZero(Term.Zero zero);
}
