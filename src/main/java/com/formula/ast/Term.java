package com.formula.ast;

import java.util.List;

/**
 * Right-hand side term.
 */
public sealed interface Term {

    <R> R accept(TermVisitor<R> visitor);

    record Column(String name) implements Term {
        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitColumn(this);
        }
    }

    record Function(String name, List<Argument> args) implements Term {
        public Function {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    /**
     * Chained interactions nest to the right: {@code a:b:c} is {@code Interaction(a, Interaction(b, c))}.
     */
    record Interaction(Term left, Term right) implements Term {
        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitInteraction(this);
        }
    }

    record RandomEffectTerm(RandomEffect randomEffect) implements Term {
        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitRandomEffect(this);
        }
    }

    /**
     * Explicit {@code 1}.
     */
    record Intercept() implements Term {
        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitIntercept(this);
        }
    }

    /**
     * Explicit {@code 0}: the model has no intercept.
     */
    record Zero() implements Term {
        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitZero(this);
        }
    }
}
