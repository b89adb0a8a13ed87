package org.py2smt.translator.backend;

import org.py2smt.translator.api.TranslationException;
import org.py2smt.translator.api.TypeConfig;
import org.py2smt.translator.frontend.parser.ast.FunctionDefNode;
import org.py2smt.translator.frontend.parser.ast.ParameterNode;
import org.py2smt.translator.smt.SExpr;

import java.util.ArrayList;
import java.util.List;

import static org.py2smt.translator.smt.SExpr.atom;
import static org.py2smt.translator.smt.SExpr.list;

/**
 * Wraps a translated function body into
 * {@code (define-fun name ((p0 T) (p1 T) ...) R body)}.
 */
public final class FunctionAssembler {

    private final TranslationContext ctx;
    private final StatementTranslator statements;

    public FunctionAssembler(TranslationContext ctx) {
        this.ctx = ctx;
        this.statements = new StatementTranslator(ctx);
    }

    /**
     * @param function The function definition.
     * @return The {@code define-fun} form.
     * @throws TranslationException if the body cannot be translated.
     */
    public SExpr assemble(FunctionDefNode function) throws TranslationException {
        TypeConfig types = ctx.types();
        List<SExpr> parameters = new ArrayList<>();
        for (ParameterNode parameter : function.parameters()) {
            parameters.add(list(atom(parameter.name()), atom(types.parameterType())));
        }
        SExpr body = statements.translateBody(function.body(), function.line());
        return list(atom("define-fun"), atom(function.name()), list(parameters), atom(types.returnType()), body);
    }
}
