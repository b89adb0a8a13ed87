package org.py2smt.translator.frontend.parser.ast;

/**
 * Unary operators of the source language.
 */
public enum UnaryOperator {
    /** Arithmetic negation, {@code -x}. */
    NEG("-"),
    /** Boolean negation, {@code not x}. */
    NOT("not");

    private final String sourceSymbol;

    UnaryOperator(String sourceSymbol) {
        this.sourceSymbol = sourceSymbol;
    }

    public String sourceSymbol() {
        return sourceSymbol;
    }
}
