package org.py2smt.translator.frontend.parser.ast;

/**
 * An expression evaluated for its effect, e.g. a bare call.
 *
 * @param expression The expression.
 * @param line The line of the statement.
 */
public record ExpressionStatementNode(Expression expression, int line) implements Statement {
}
