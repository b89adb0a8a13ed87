package org.py2smt.translator.frontend.parser.ast;

/**
 * Binary operators of the source language.
 */
public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    AND("and"),
    OR("or");

    private final String sourceSymbol;

    BinaryOperator(String sourceSymbol) {
        this.sourceSymbol = sourceSymbol;
    }

    /**
     * @return The operator as written in the source.
     */
    public String sourceSymbol() {
        return sourceSymbol;
    }

    /**
     * @return {@code true} for the six comparison operators.
     */
    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
    }
}
