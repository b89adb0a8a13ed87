package org.py2smt.translator.backend;

import org.py2smt.translator.api.TranslationException;
import org.py2smt.translator.api.TranslatorErrorCode;
import org.py2smt.translator.api.UnsupportedConstructException;
import org.py2smt.translator.diagnostics.TranslatorLogger;
import org.py2smt.translator.frontend.parser.ast.AssignNode;
import org.py2smt.translator.frontend.parser.ast.ConditionalNode;
import org.py2smt.translator.frontend.parser.ast.ExpressionStatementNode;
import org.py2smt.translator.frontend.parser.ast.LoopNode;
import org.py2smt.translator.frontend.parser.ast.ReturnNode;
import org.py2smt.translator.frontend.parser.ast.Statement;
import org.py2smt.translator.frontend.parser.ast.UnsupportedStatementNode;
import org.py2smt.translator.smt.SExpr;

import java.util.ArrayList;
import java.util.List;

import static org.py2smt.translator.smt.SExpr.atom;
import static org.py2smt.translator.smt.SExpr.list;

/**
 * Translates a statement sequence, the body of a function or of a branch,
 * into one SMT-LIB2 expression.
 * <p>
 * Every assignment scopes over the entire remainder of the enclosing body.
 * In the legacy layout that remainder is written as siblings after a
 * {@code (let x v)} form; in the strict layout it is nested into
 * {@code (let ((x v)) rest)}.
 */
public final class StatementTranslator {

    private final TranslationContext ctx;
    private final ExpressionTranslator expressions;
    private final ConditionalTranslator conditionals;

    public StatementTranslator(TranslationContext ctx) {
        this.ctx = ctx;
        this.expressions = new ExpressionTranslator(ctx);
        this.conditionals = new ConditionalTranslator(ctx, expressions, this);
    }

    /**
     * Translates a body.
     *
     * @param body The statements in source order.
     * @return A {@link SExpr.Sequence} of siblings in the legacy layout, a single term in the strict layout.
     * @throws TranslationException if a statement cannot be translated, or if in the strict layout
     *         a path through the body ends without a return value.
     */
    public SExpr translateBody(List<Statement> body) throws TranslationException {
        return translateBody(body, body.isEmpty() ? 0 : body.get(0).line());
    }

    /**
     * Translates a body that belongs to a construct at {@code ownerLine}. The
     * line is used when an empty strict body has to be reported.
     *
     * @param body The statements in source order.
     * @param ownerLine The line of the enclosing {@code def}, branch or conditional.
     * @return The translated body.
     * @throws TranslationException if the body cannot be translated.
     */
    public SExpr translateBody(List<Statement> body, int ownerLine) throws TranslationException {
        if (ctx.strict()) {
            return translateStrict(body, 0, ownerLine);
        }
        return new SExpr.Sequence(translateLegacy(body));
    }

    private List<SExpr> translateLegacy(List<Statement> body) throws TranslationException {
        List<SExpr> out = new ArrayList<>();
        for (int i = 0; i < body.size(); i++) {
            Statement statement = body.get(i);
            if (statement instanceof AssignNode assign) {
                out.add(list(atom("let"), atom(assign.target()), expressions.translate(assign.value())));
            } else if (statement instanceof ReturnNode ret) {
                out.add(expressions.translate(ret.value()));
            } else if (statement instanceof ConditionalNode conditional) {
                SExpr translated = conditionals.translate(conditional, body.subList(i + 1, body.size()));
                if (translated instanceof SExpr.Sequence siblings) {
                    out.addAll(siblings.items());
                } else {
                    out.add(translated);
                }
                return out;
            } else {
                throw unsupported(statement);
            }
        }
        return out;
    }

    private SExpr translateStrict(List<Statement> body, int index, int ownerLine) throws TranslationException {
        if (index >= body.size()) {
            int line = body.isEmpty() ? ownerLine : body.get(body.size() - 1).line();
            throw new TranslationException(TranslatorErrorCode.MISSING_RETURN_VALUE,
                    "Control flow reaches the end of the body without a return value", ctx.sourceAt(line));
        }
        Statement statement = body.get(index);
        if (statement instanceof AssignNode assign) {
            SExpr binding = list(atom(assign.target()), expressions.translate(assign.value()));
            return list(atom("let"), list(binding), translateStrict(body, index + 1, ownerLine));
        }
        if (statement instanceof ReturnNode ret) {
            if (index + 1 < body.size()) {
                TranslatorLogger.debug(String.format("%s: dropping %d unreachable statement(s) after return",
                        ctx.sourceOf(ret), body.size() - index - 1));
            }
            return expressions.translate(ret.value());
        }
        if (statement instanceof ConditionalNode conditional) {
            return conditionals.translate(conditional, body.subList(index + 1, body.size()));
        }
        throw unsupported(statement);
    }

    private UnsupportedConstructException unsupported(Statement statement) {
        String construct;
        if (statement instanceof LoopNode loop) {
            construct = loop.keyword() + " loop";
        } else if (statement instanceof ExpressionStatementNode) {
            construct = "expression statement";
        } else if (statement instanceof UnsupportedStatementNode u) {
            construct = u.description();
        } else {
            construct = statement.getClass().getSimpleName();
        }
        return new UnsupportedConstructException(construct, ctx.sourceOf(statement));
    }
}
