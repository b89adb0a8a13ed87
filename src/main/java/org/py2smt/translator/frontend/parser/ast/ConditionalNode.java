package org.py2smt.translator.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A whole {@code if}/{@code elif}/{@code else} chain. Branch order is
 * significant: the first branch whose condition holds is taken.
 *
 * @param branches The {@code if} branch followed by every {@code elif} branch.
 * @param elseBody The {@code else} body, or {@code null} if the chain has none.
 * @param line The line of the {@code if} keyword.
 */
public record ConditionalNode(List<Branch> branches, List<Statement> elseBody, int line) implements Statement {

    public ConditionalNode {
        branches = List.copyOf(branches);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    /**
     * @return The {@code else} body, if present.
     */
    public Optional<List<Statement>> elseBranch() {
        return Optional.ofNullable(elseBody);
    }

    /**
     * One guarded body of the chain.
     *
     * @param condition The guard.
     * @param body The statements executed when the guard holds.
     */
    public record Branch(Expression condition, List<Statement> body) {

        public Branch {
            body = List.copyOf(body);
        }
    }
}
