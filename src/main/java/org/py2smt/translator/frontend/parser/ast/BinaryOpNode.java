package org.py2smt.translator.frontend.parser.ast;

/**
 * {@code left operator right}.
 *
 * @param operator The operator.
 * @param left The left operand.
 * @param right The right operand.
 * @param line The line of the left operand.
 */
public record BinaryOpNode(BinaryOperator operator, Expression left, Expression right, int line) implements Expression {
}
