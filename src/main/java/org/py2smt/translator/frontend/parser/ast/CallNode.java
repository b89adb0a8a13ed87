package org.py2smt.translator.frontend.parser.ast;

import java.util.List;

/**
 * A call such as {@code abs(x)}. Parsed only to be rejected.
 *
 * @param callee The called expression.
 * @param arguments The positional arguments.
 * @param line The line of the callee.
 */
public record CallNode(Expression callee, List<Expression> arguments, int line) implements Expression {

    public CallNode {
        arguments = List.copyOf(arguments);
    }
}
