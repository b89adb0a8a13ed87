package org.py2smt.translator.frontend.parser.ast;

/**
 * A string literal. Parsed only to be rejected.
 *
 * @param value The literal contents without quotes.
 * @param line The line of the literal.
 */
public record StringLiteralNode(String value, int line) implements Expression {
}
