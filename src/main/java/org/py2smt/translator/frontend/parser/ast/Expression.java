package org.py2smt.translator.frontend.parser.ast;

/**
 * An expression. Operator precedence is already encoded in the tree shape.
 */
public sealed interface Expression extends AstNode
        permits NumberLiteralNode, BooleanLiteralNode, IdentifierNode, BinaryOpNode, UnaryOpNode,
                CallNode, StringLiteralNode, UnsupportedExpressionNode {
}
