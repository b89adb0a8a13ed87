package org.py2smt.translator.frontend.parser.ast;

import java.util.List;

/**
 * A parsed source file: its top-level function definitions in source order.
 *
 * @param functions The function definitions.
 */
public record ModuleNode(List<FunctionDefNode> functions) {

    public ModuleNode {
        functions = List.copyOf(functions);
    }
}
