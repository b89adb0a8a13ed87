package org.py2smt.translator.frontend.parser.ast;

/**
 * {@code operator operand}.
 *
 * @param operator The operator.
 * @param operand The operand.
 * @param line The line of the operator.
 */
public record UnaryOpNode(UnaryOperator operator, Expression operand, int line) implements Expression {
}
