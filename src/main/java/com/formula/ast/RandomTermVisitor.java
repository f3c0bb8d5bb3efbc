package com.formula.ast;

/**
 * Visitor over every {@link RandomTerm} kind.
 */
public interface RandomTermVisitor<R> {

    R visitColumn(RandomTerm.Column column);

    R visitFunction(RandomTerm.Function function);

    R visitInteraction(RandomTerm.Interaction interaction);

    R visitIntercept(RandomTerm.Intercept intercept);

    R visitSuppressIntercept(RandomTerm.SuppressIntercept suppress);
}
