package org.py2smt.translator.frontend.parser.ast;

/**
 * The base interface for all nodes of the syntax tree.
 */
public interface AstNode {
    /**
     * @return The 1-based source line the node starts on.
     */
    int line();
}
