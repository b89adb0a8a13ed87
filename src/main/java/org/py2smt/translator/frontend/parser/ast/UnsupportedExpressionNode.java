package org.py2smt.translator.frontend.parser.ast;

/**
 * An expression the parser recognises but the translator has no encoding
 * for, such as {@code None}, {@code x ** 2}, {@code a in b} or a list display.
 *
 * @param description A short human-readable name of the construct.
 * @param line The line the expression starts on.
 */
public record UnsupportedExpressionNode(String description, int line) implements Expression {
}
