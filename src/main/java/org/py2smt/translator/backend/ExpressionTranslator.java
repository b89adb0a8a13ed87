package org.py2smt.translator.backend;

import org.py2smt.translator.api.UnsupportedConstructException;
import org.py2smt.translator.frontend.parser.ast.BinaryOpNode;
import org.py2smt.translator.frontend.parser.ast.BinaryOperator;
import org.py2smt.translator.frontend.parser.ast.BooleanLiteralNode;
import org.py2smt.translator.frontend.parser.ast.CallNode;
import org.py2smt.translator.frontend.parser.ast.Expression;
import org.py2smt.translator.frontend.parser.ast.IdentifierNode;
import org.py2smt.translator.frontend.parser.ast.NumberLiteralNode;
import org.py2smt.translator.frontend.parser.ast.StringLiteralNode;
import org.py2smt.translator.frontend.parser.ast.UnaryOpNode;
import org.py2smt.translator.frontend.parser.ast.UnsupportedExpressionNode;
import org.py2smt.translator.smt.SExpr;

import java.util.EnumMap;
import java.util.Map;

import static org.py2smt.translator.smt.SExpr.atom;
import static org.py2smt.translator.smt.SExpr.list;

/**
 * Translates expressions into SMT-LIB2 terms.
 * <p>
 * Binary operators map one-to-one onto SMT-LIB2 functions, except {@code !=},
 * which becomes {@code (not (= l r))}, and {@code %}, which becomes {@code mod}.
 * The function used for {@code /} comes from {@link org.py2smt.translator.api.TranslationOptions}.
 */
public final class ExpressionTranslator {

    private static final Map<BinaryOperator, String> SYMBOLS = new EnumMap<>(BinaryOperator.class);

    static {
        SYMBOLS.put(BinaryOperator.ADD, "+");
        SYMBOLS.put(BinaryOperator.SUB, "-");
        SYMBOLS.put(BinaryOperator.MUL, "*");
        SYMBOLS.put(BinaryOperator.MOD, "mod");
        SYMBOLS.put(BinaryOperator.EQ, "=");
        SYMBOLS.put(BinaryOperator.LT, "<");
        SYMBOLS.put(BinaryOperator.LE, "<=");
        SYMBOLS.put(BinaryOperator.GT, ">");
        SYMBOLS.put(BinaryOperator.GE, ">=");
        SYMBOLS.put(BinaryOperator.AND, "and");
        SYMBOLS.put(BinaryOperator.OR, "or");
    }

    private final TranslationContext ctx;

    public ExpressionTranslator(TranslationContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Translates one expression tree.
     *
     * @param expression The expression.
     * @return The equivalent SMT-LIB2 term.
     * @throws UnsupportedConstructException if the tree contains a call, a string or another
     *         expression kind without an SMT-LIB2 encoding.
     */
    public SExpr translate(Expression expression) throws UnsupportedConstructException {
        if (expression instanceof NumberLiteralNode n) {
            return atom(formatNumber(n));
        }
        if (expression instanceof BooleanLiteralNode b) {
            return atom(b.value() ? "true" : "false");
        }
        if (expression instanceof IdentifierNode id) {
            String lower = id.name().toLowerCase();
            if (lower.equals("true") || lower.equals("false")) {
                return atom(lower);
            }
            return atom(id.name());
        }
        if (expression instanceof BinaryOpNode bin) {
            SExpr left = translate(bin.left());
            SExpr right = translate(bin.right());
            if (bin.operator() == BinaryOperator.NE) {
                return list(atom("not"), list(atom("="), left, right));
            }
            return list(atom(symbolOf(bin.operator())), left, right);
        }
        if (expression instanceof UnaryOpNode un) {
            return list(atom(un.operator().sourceSymbol()), translate(un.operand()));
        }
        if (expression instanceof CallNode call) {
            String callee = call.callee() instanceof IdentifierNode id ? " '" + id.name() + "'" : "";
            throw new UnsupportedConstructException("function call" + callee, ctx.sourceOf(call));
        }
        if (expression instanceof StringLiteralNode s) {
            throw new UnsupportedConstructException("string literal", ctx.sourceOf(s));
        }
        if (expression instanceof UnsupportedExpressionNode u) {
            throw new UnsupportedConstructException(u.description(), ctx.sourceOf(u));
        }
        throw new UnsupportedConstructException(expression.getClass().getSimpleName(), ctx.sourceOf(expression));
    }

    /**
     * @param operator A binary operator other than {@code !=}.
     * @return The SMT-LIB2 function symbol for it.
     */
    public String symbolOf(BinaryOperator operator) {
        if (operator == BinaryOperator.DIV) {
            return ctx.options().divisionSymbol();
        }
        String symbol = SYMBOLS.get(operator);
        if (symbol == null) {
            throw new IllegalArgumentException("No single symbol for operator " + operator);
        }
        return symbol;
    }

    /**
     * Integers print in plain decimal; reals print without exponent and
     * always with a fractional part ({@code 5.} becomes {@code 5.0}).
     */
    static String formatNumber(NumberLiteralNode n) {
        if (n.integral()) {
            return n.value().toBigInteger().toString();
        }
        String text = n.value().stripTrailingZeros().toPlainString();
        return text.indexOf('.') < 0 ? text + ".0" : text;
    }
}
