package org.py2smt.translator.frontend.parser.ast;

/**
 * {@code True} or {@code False}.
 *
 * @param value The literal value.
 * @param line The line of the literal.
 */
public record BooleanLiteralNode(boolean value, int line) implements Expression {
}
