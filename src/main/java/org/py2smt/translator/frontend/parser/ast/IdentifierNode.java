package org.py2smt.translator.frontend.parser.ast;

/**
 * A reference to a parameter or an assigned name.
 *
 * @param name The identifier as written.
 * @param line The line of the identifier.
 */
public record IdentifierNode(String name, int line) implements Expression {
}
