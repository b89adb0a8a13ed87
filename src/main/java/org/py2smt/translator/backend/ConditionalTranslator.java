package org.py2smt.translator.backend;

import org.py2smt.translator.api.MalformedConditionalException;
import org.py2smt.translator.api.TranslationException;
import org.py2smt.translator.frontend.parser.ast.ConditionalNode;
import org.py2smt.translator.frontend.parser.ast.Statement;
import org.py2smt.translator.smt.SExpr;

import java.util.ArrayList;
import java.util.List;

import static org.py2smt.translator.smt.SExpr.atom;
import static org.py2smt.translator.smt.SExpr.list;

/**
 * Folds an {@code if}/{@code elif}/{@code else} chain into nested {@code ite}
 * terms, the first branch outermost: {@code (ite c0 t0 (ite c1 t1 fallback))}.
 */
public final class ConditionalTranslator {

    private final TranslationContext ctx;
    private final ExpressionTranslator expressions;
    private final StatementTranslator bodies;

    ConditionalTranslator(TranslationContext ctx, ExpressionTranslator expressions, StatementTranslator bodies) {
        this.ctx = ctx;
        this.expressions = expressions;
        this.bodies = bodies;
    }

    /**
     * Translates a conditional chain together with the statements that follow it.
     * <p>
     * Legacy layout: each branch translates its own body only, a missing
     * {@code else} leaves an empty slot, and the continuation is written as
     * siblings after the {@code ite}. The result is a {@link SExpr.Sequence}.
     * <p>
     * Strict layout: the continuation is appended to every branch and to the
     * fallback, so the result is a single term.
     *
     * @param conditional The chain.
     * @param continuation The statements after the chain in the same body.
     * @return The translated chain.
     * @throws MalformedConditionalException if the chain has no branch.
     * @throws TranslationException if a condition or body cannot be translated.
     */
    public SExpr translate(ConditionalNode conditional, List<Statement> continuation) throws TranslationException {
        if (conditional.branches().isEmpty()) {
            throw new MalformedConditionalException(ctx.sourceOf(conditional));
        }
        boolean strict = ctx.strict();

        List<SExpr> conditions = new ArrayList<>();
        List<SExpr> thens = new ArrayList<>();
        for (ConditionalNode.Branch branch : conditional.branches()) {
            List<Statement> body = branch.body();
            if (strict) {
                body = new ArrayList<>(body);
                body.addAll(continuation);
            }
            conditions.add(expressions.translate(branch.condition()));
            thens.add(bodies.translateBody(body, branch.condition().line()));
        }

        SExpr result;
        if (strict) {
            List<Statement> tail = new ArrayList<>(conditional.elseBranch().orElse(List.of()));
            tail.addAll(continuation);
            result = bodies.translateBody(tail, conditional.line());
        } else if (conditional.elseBranch().isPresent()) {
            result = bodies.translateBody(conditional.elseBody(), conditional.line());
        } else {
            result = SExpr.EMPTY;
        }
        for (int k = conditions.size() - 1; k >= 0; k--) {
            result = list(atom("ite"), conditions.get(k), thens.get(k), result);
        }

        if (strict) {
            return result;
        }
        List<SExpr> siblings = new ArrayList<>();
        siblings.add(result);
        SExpr rest = bodies.translateBody(continuation, conditional.line());
        if (rest instanceof SExpr.Sequence s) {
            siblings.addAll(s.items());
        } else {
            siblings.add(rest);
        }
        return new SExpr.Sequence(siblings);
    }
}
