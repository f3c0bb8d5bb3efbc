package com.formula.ast;

import java.util.List;

/**
 * Grouping factor on the right of the bar in a random-effects block.
 */
public sealed interface Grouping {

    <R> R accept(GroupingVisitor<R> visitor);

    record Simple(String name) implements Grouping {
        @Override
        public <R> R accept(GroupingVisitor<R> visitor) {
            return visitor.visitSimple(this);
        }
    }

    /**
     * {@code gr(group, cor = FALSE, id = "a", ...)}.
     */
    record Gr(String group, List<GrOption> options) implements Grouping {
        public Gr {
            options = List.copyOf(options);
        }

        /**
         * Value of the {@code cor} option, true when absent.
         */
        public boolean correlated() {
            for (GrOption option : options) {
                if (option instanceof GrOption.Cor cor) {
                    return cor.enabled();
                }
            }
            return true;
        }

        @Override
        public <R> R accept(GroupingVisitor<R> visitor) {
            return visitor.visitGr(this);
        }
    }

    /**
     * Multi-membership {@code mm(g1, g2, ...)}.
     */
    record Mm(List<String> groups) implements Grouping {
        public Mm {
            groups = List.copyOf(groups);
        }

        @Override
        public <R> R accept(GroupingVisitor<R> visitor) {
            return visitor.visitMm(this);
        }
    }

    /**
     * Crossed grouping {@code left:right}.
     */
    record Interaction(String left, String right) implements Grouping {
        @Override
        public <R> R accept(GroupingVisitor<R> visitor) {
            return visitor.visitInteraction(this);
        }
    }

    /**
     * Nested grouping {@code outer/inner}.
     */
    record Nested(String outer, String inner) implements Grouping {
        @Override
        public <R> R accept(GroupingVisitor<R> visitor) {
            return visitor.visitNested(this);
        }
    }
}
