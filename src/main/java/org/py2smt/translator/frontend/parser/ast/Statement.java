package org.py2smt.translator.frontend.parser.ast;

/**
 * A statement inside a function body.
 * <p>
 * Only {@link AssignNode}, {@link ConditionalNode} and {@link ReturnNode} can be
 * translated; the remaining kinds are produced so that the translator can
 * reject them with a precise message.
 */
public sealed interface Statement extends AstNode
        permits AssignNode, ConditionalNode, ReturnNode, LoopNode, ExpressionStatementNode, UnsupportedStatementNode {
}
