package com.formula.ast;

/**
 * Visitor over every {@link Grouping} kind.
 */
public interface GroupingVisitor<R> {

    R visitSimple(Grouping.Simple simple);

    R visitGr(Grouping.Gr gr);

    R visitMm(Grouping.Mm mm);

    R visitInteraction(Grouping.Interaction interaction);

    R visitNested(Grouping.Nested nested);
}
