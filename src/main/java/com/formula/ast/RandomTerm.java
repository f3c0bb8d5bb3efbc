package com.formula.ast;

import java.util.List;

/**
 * Term on the left of the bar in a random-effects block.
 */
public sealed interface RandomTerm {

    <R> R accept(RandomTermVisitor<R> visitor);

    record Column(String name) implements RandomTerm {
        @Override
        public <R> R accept(RandomTermVisitor<R> visitor) {
            return visitor.visitColumn(this);
        }
    }

    record Function(String name, List<Argument> args) implements RandomTerm {
        public Function {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(RandomTermVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    record Interaction(RandomTerm left, RandomTerm right) implements RandomTerm {
        @Override
        public <R> R accept(RandomTermVisitor<R> visitor) {
            return visitor.visitInteraction(this);
        }
    }

    /**
     * Explicit {@code 1} in {@code (1 + x | g)}.
     */
    record Intercept() implements RandomTerm {
        @Override
        public <R> R accept(RandomTermVisitor<R> visitor) {
            return visitor.visitIntercept(this);
        }
    }

    /**
     * {@code 0 + ...}, {@code -1} or {@code -0}: the block has no intercept.
     */
    record SuppressIntercept() implements RandomTerm {
        @Override
        public <R> R accept(RandomTermVisitor<R> visitor) {
            return visitor.visitSuppressIntercept(this);
        }
    }
}
