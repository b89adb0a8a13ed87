package org.py2smt.translator.frontend.parser.ast;

/**
 * {@code return value}.
 *
 * @param value The returned expression, never {@code null}.
 * @param line The line of the statement.
 */
public record ReturnNode(Expression value, int line) implements Statement {
}
