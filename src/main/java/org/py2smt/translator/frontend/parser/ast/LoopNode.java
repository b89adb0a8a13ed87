package org.py2smt.translator.frontend.parser.ast;

import java.util.List;

/**
 * A {@code for} or {@code while} loop. Parsed only to be rejected.
 *
 * @param keyword {@code "for"} or {@code "while"}.
 * @param body The loop body.
 * @param line The line of the loop keyword.
 */
public record LoopNode(String keyword, List<Statement> body, int line) implements Statement {

    public LoopNode {
        body = List.copyOf(body);
    }
}
