package org.py2smt.translator.frontend.parser.ast;

/**
 * A function parameter. Its sort comes from the type configuration, never
 * from the source.
 *
 * @param name The parameter name.
 * @param line The line the parameter appears on.
 */
public record ParameterNode(String name, int line) implements AstNode {
}
