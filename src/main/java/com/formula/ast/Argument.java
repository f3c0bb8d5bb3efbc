package com.formula.ast;

/**
 * Function call argument.
 */
public sealed interface Argument {

    /**
     * Plain value of this argument as it appears in transformation parameters.
     */
    Object value();

    record Ident(String name) implements Argument {
        @Override
        public Object value() {
            return name;
        }
    }

    record IntLiteral(int number) implements Argument {
        @Override
        public Object value() {
            return number;
        }
    }

    /**
     * String literal without its surrounding quotes.
     */
    record StringLiteral(String text) implements Argument {
        @Override
        public Object value() {
            return text;
        }
    }

    record BoolLiteral(boolean flag) implements Argument {
        @Override
        public Object value() {
            return flag;
        }
    }

    /**
     * {@code name = value}, e.g. {@code ref = control}.
     */
    record Named(String name, Argument argument) implements Argument {
        @Override
        public Object value() {
            return argument.value();
        }
    }
}
