package org.py2smt.translator.frontend.parser.ast;

/**
 * {@code target = value}. Binds the name for the rest of the enclosing body.
 *
 * @param target The assigned name.
 * @param value The assigned expression.
 * @param line The line of the assignment.
 */
public record AssignNode(String target, Expression value, int line) implements Statement {
}
