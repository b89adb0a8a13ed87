package org.py2smt.translator.backend;

import org.py2smt.junit.extensions.logging.LogWatchExtension;
import org.py2smt.translator.api.MalformedConditionalException;
import org.py2smt.translator.api.TranslationException;
import org.py2smt.translator.api.TranslationOptions;
import org.py2smt.translator.api.TranslatorErrorCode;
import org.py2smt.translator.api.TypeConfig;
import org.py2smt.translator.api.UnsupportedConstructException;
import org.py2smt.translator.frontend.parser.ast.AssignNode;
import org.py2smt.translator.frontend.parser.ast.BinaryOpNode;
import org.py2smt.translator.frontend.parser.ast.BinaryOperator;
import org.py2smt.translator.frontend.parser.ast.ConditionalNode;
import org.py2smt.translator.frontend.parser.ast.Expression;
import org.py2smt.translator.frontend.parser.ast.IdentifierNode;
import org.py2smt.translator.frontend.parser.ast.LoopNode;
import org.py2smt.translator.frontend.parser.ast.NumberLiteralNode;
import org.py2smt.translator.frontend.parser.ast.ReturnNode;
import org.py2smt.translator.frontend.parser.ast.Statement;
import org.py2smt.translator.smt.SmtWriter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests body translation, including conditionals, in both layouts.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class StatementTranslatorTest {

    private static Expression id(String name) {
        return new IdentifierNode(name, 1);
    }

    private static Expression num(int value) {
        return new NumberLiteralNode(BigDecimal.valueOf(value), true, 1);
    }

    private static Expression gt(Expression l, Expression r) {
        return new BinaryOpNode(BinaryOperator.GT, l, r, 1);
    }

    private static Statement ret(Expression value) {
        return new ReturnNode(value, 1);
    }

    private static String legacy(List<Statement> body) throws TranslationException {
        return SmtWriter.write(new StatementTranslator(context(false)).translateBody(body));
    }

    private static String strict(List<Statement> body) throws TranslationException {
        return SmtWriter.write(new StatementTranslator(context(true)).translateBody(body));
    }

    private static TranslationContext context(boolean strict) {
        return new TranslationContext("test.py", TypeConfig.DEFAULT, TranslationOptions.DEFAULT.withStrict(strict));
    }

    @Test
    void assignmentsBecomeLetFormsInSourceOrder() throws Exception {
        List<Statement> body = List.of(
                new AssignNode("a", num(1), 1),
                new AssignNode("b", id("a"), 2),
                ret(id("b")));

        assertThat(legacy(body)).isEqualTo("(let a 1)\n(let b a)\nb");
        assertThat(strict(body)).isEqualTo("(let ((a 1)) (let ((b a)) b))");
    }

    @Test
    void branchesAreFoldedFirstBranchOutermost() throws Exception {
        ConditionalNode conditional = new ConditionalNode(List.of(
                new ConditionalNode.Branch(gt(id("x"), num(2)), List.of(ret(num(2)))),
                new ConditionalNode.Branch(gt(id("x"), num(1)), List.of(ret(num(1))))),
                List.of(ret(num(0))), 1);

        assertThat(legacy(List.of(conditional))).isEqualTo("(ite (> x 2) 2 (ite (> x 1) 1 0))");
        assertThat(strict(List.of(conditional))).isEqualTo("(ite (> x 2) 2 (ite (> x 1) 1 0))");
    }

    @Test
    void legacyLayoutLeavesEmptyElseSlotAndAppendsContinuation() throws Exception {
        ConditionalNode conditional = new ConditionalNode(List.of(
                new ConditionalNode.Branch(gt(id("x"), num(0)), List.of(ret(id("x"))))), null, 1);
        List<Statement> body = List.of(conditional, ret(num(0)));

        assertThat(legacy(body)).isEqualTo("(ite (> x 0) x )\n0");
    }

    @Test
    void strictLayoutMovesContinuationIntoTheFallback() throws Exception {
        ConditionalNode conditional = new ConditionalNode(List.of(
                new ConditionalNode.Branch(gt(id("x"), num(0)), List.of(new AssignNode("x", num(1), 2)))), null, 1);
        List<Statement> body = List.of(conditional, ret(id("x")));

        assertThat(strict(body)).isEqualTo("(ite (> x 0) (let ((x 1)) x) x)");
    }

    @Test
    void strictLayoutRejectsPathsWithoutValue() {
        ConditionalNode conditional = new ConditionalNode(List.of(
                new ConditionalNode.Branch(gt(id("x"), num(0)), List.of(ret(id("x"))))), null, 4);

        assertThatThrownBy(() -> strict(List.of(conditional)))
                .isInstanceOf(TranslationException.class)
                .extracting(e -> ((TranslationException) e).getErrorCode())
                .isEqualTo(TranslatorErrorCode.MISSING_RETURN_VALUE);
    }

    @Test
    void statementsAfterReturnAreKeptInLegacyAndDroppedInStrictLayout() throws Exception {
        List<Statement> body = List.of(ret(num(1)), ret(num(2)));

        assertThat(legacy(body)).isEqualTo("1\n2");
        assertThat(strict(body)).isEqualTo("1");
    }

    @Test
    void conditionalWithoutBranchesIsMalformed() {
        ConditionalNode empty = new ConditionalNode(List.of(), List.of(ret(num(0))), 9);

        assertThatThrownBy(() -> legacy(List.of(empty)))
                .isInstanceOf(MalformedConditionalException.class)
                .hasMessageContaining("test.py:9");
    }

    @Test
    void loopsAreUnsupported() {
        List<Statement> body = List.of(new LoopNode("while", List.of(ret(num(1))), 3), ret(num(0)));

        assertThatThrownBy(() -> legacy(body))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessage("Unsupported construct: while loop at test.py:3");
    }
}
