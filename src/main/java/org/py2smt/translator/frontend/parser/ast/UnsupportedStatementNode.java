package org.py2smt.translator.frontend.parser.ast;

/**
 * A statement the parser recognises but the translator has no encoding for,
 * such as {@code pass}, augmented or chained assignment, or a bare {@code return}.
 *
 * @param description A short human-readable name of the construct.
 * @param line The line of the statement.
 */
public record UnsupportedStatementNode(String description, int line) implements Statement {
}
