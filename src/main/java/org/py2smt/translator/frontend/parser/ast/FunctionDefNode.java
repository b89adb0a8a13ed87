package org.py2smt.translator.frontend.parser.ast;

import java.util.List;

/**
 * A single {@code def}.
 *
 * @param name The function name.
 * @param parameters The parameters in declaration order.
 * @param body The statements of the body.
 * @param line The line of the {@code def} keyword.
 */
public record FunctionDefNode(
        String name,
        List<ParameterNode> parameters,
        List<Statement> body,
        int line
) implements AstNode {

    public FunctionDefNode {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }
}
