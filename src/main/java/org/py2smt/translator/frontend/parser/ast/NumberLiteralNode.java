package org.py2smt.translator.frontend.parser.ast;

import java.math.BigDecimal;

/**
 * A non-negative numeric literal. Negative numbers are a unary minus applied
 * to a literal.
 *
 * @param value The numeric value.
 * @param integral {@code true} for integer literals, {@code false} for reals.
 * @param line The line of the literal.
 */
public record NumberLiteralNode(BigDecimal value, boolean integral, int line) implements Expression {
}
