package org.py2smt.translator.frontend;

import org.py2smt.translator.diagnostics.DiagnosticsEngine;
import org.py2smt.translator.frontend.lexer.Lexer;
import org.py2smt.translator.frontend.parser.Parser;
import org.py2smt.translator.frontend.parser.ast.AssignNode;
import org.py2smt.translator.frontend.parser.ast.BinaryOpNode;
import org.py2smt.translator.frontend.parser.ast.BinaryOperator;
import org.py2smt.translator.frontend.parser.ast.CallNode;
import org.py2smt.translator.frontend.parser.ast.ConditionalNode;
import org.py2smt.translator.frontend.parser.ast.Expression;
import org.py2smt.translator.frontend.parser.ast.FunctionDefNode;
import org.py2smt.translator.frontend.parser.ast.IdentifierNode;
import org.py2smt.translator.frontend.parser.ast.LoopNode;
import org.py2smt.translator.frontend.parser.ast.ModuleNode;
import org.py2smt.translator.frontend.parser.ast.NumberLiteralNode;
import org.py2smt.translator.frontend.parser.ast.ParameterNode;
import org.py2smt.translator.frontend.parser.ast.ReturnNode;
import org.py2smt.translator.frontend.parser.ast.UnaryOpNode;
import org.py2smt.translator.frontend.parser.ast.UnaryOperator;
import org.py2smt.translator.frontend.parser.ast.UnsupportedExpressionNode;
import org.py2smt.translator.frontend.parser.ast.UnsupportedStatementNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the parser on source text, through the lexer.
 */
@Tag("unit")
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private ModuleNode parse(String... lines) {
        diagnostics = new DiagnosticsEngine();
        String source = String.join("\n", lines) + "\n";
        return new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parseModule();
    }

    private Expression returnedExpression(String expression) {
        ModuleNode module = parse("def f(a, b, c):", "    return " + expression);
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return ((ReturnNode) module.functions().get(0).body().get(0)).value();
    }

    @Test
    void parsesFunctionSignatureAndBody() {
        ModuleNode module = parse(
                "def example_function(radius: int, scale=2) -> int:",
                "    pi = 3.14",
                "    return pi * radius");

        assertThat(diagnostics.hasErrors()).isFalse();
        FunctionDefNode function = module.functions().get(0);
        assertThat(function.name()).isEqualTo("example_function");
        assertThat(function.parameters()).extracting(ParameterNode::name).containsExactly("radius", "scale");
        assertThat(function.body()).hasSize(2);
        assertThat(function.body().get(0)).isInstanceOf(AssignNode.class);
        assertThat(((AssignNode) function.body().get(0)).target()).isEqualTo("pi");
        assertThat(function.body().get(1)).isInstanceOf(ReturnNode.class);
        assertThat(function.line()).isEqualTo(1);
    }

    @Test
    void multiplicationBindsTighterThanAdditionAndIsLeftAssociative() {
        Expression e = returnedExpression("a + b * c - a");

        BinaryOpNode sub = (BinaryOpNode) e;
        assertThat(sub.operator()).isEqualTo(BinaryOperator.SUB);
        BinaryOpNode add = (BinaryOpNode) sub.left();
        assertThat(add.operator()).isEqualTo(BinaryOperator.ADD);
        assertThat(((BinaryOpNode) add.right()).operator()).isEqualTo(BinaryOperator.MUL);
    }

    @Test
    void booleanOperatorsFollowPythonPrecedence() {
        Expression e = returnedExpression("not a < b or b == c and c != 0");

        BinaryOpNode or = (BinaryOpNode) e;
        assertThat(or.operator()).isEqualTo(BinaryOperator.OR);
        UnaryOpNode not = (UnaryOpNode) or.left();
        assertThat(not.operator()).isEqualTo(UnaryOperator.NOT);
        assertThat(((BinaryOpNode) not.operand()).operator()).isEqualTo(BinaryOperator.LT);
        BinaryOpNode and = (BinaryOpNode) or.right();
        assertThat(and.operator()).isEqualTo(BinaryOperator.AND);
        assertThat(((BinaryOpNode) and.left()).operator()).isEqualTo(BinaryOperator.EQ);
        assertThat(((BinaryOpNode) and.right()).operator()).isEqualTo(BinaryOperator.NE);
    }

    @Test
    void unaryMinusAppliesToTheFactor() {
        Expression e = returnedExpression("-a * 10");

        BinaryOpNode mul = (BinaryOpNode) e;
        assertThat(mul.left()).isInstanceOf(UnaryOpNode.class);
        assertThat(mul.right()).isInstanceOf(NumberLiteralNode.class);
    }

    @Test
    void chainedComparisonBecomesConjunction() {
        Expression e = returnedExpression("a < b <= c");

        BinaryOpNode and = (BinaryOpNode) e;
        assertThat(and.operator()).isEqualTo(BinaryOperator.AND);
        BinaryOpNode first = (BinaryOpNode) and.left();
        BinaryOpNode second = (BinaryOpNode) and.right();
        assertThat(first.operator()).isEqualTo(BinaryOperator.LT);
        assertThat(second.operator()).isEqualTo(BinaryOperator.LE);
        assertThat(((IdentifierNode) first.right()).name()).isEqualTo("b");
        assertThat(((IdentifierNode) second.left()).name()).isEqualTo("b");
    }

    @Test
    void elifChainBecomesOneConditionalWithOrderedBranches() {
        ModuleNode module = parse(
                "def f(x):",
                "    if x > 1:",
                "        return 1",
                "    elif x > 0:",
                "        return 0",
                "    else:",
                "        return -1");

        ConditionalNode conditional = (ConditionalNode) module.functions().get(0).body().get(0);
        assertThat(conditional.branches()).hasSize(2);
        assertThat(conditional.elseBranch()).isPresent();
        assertThat(((NumberLiteralNode) ((BinaryOpNode) conditional.branches().get(0).condition()).right())
                .value().intValueExact()).isEqualTo(1);
        assertThat(conditional.line()).isEqualTo(2);
    }

    @Test
    void conditionalWithoutElseHasNoElseBody() {
        ModuleNode module = parse(
                "def f(x):",
                "    if x: return 1",
                "    return 0");

        ConditionalNode conditional = (ConditionalNode) module.functions().get(0).body().get(0);
        assertThat(conditional.elseBranch()).isEmpty();
        assertThat(conditional.branches().get(0).body()).singleElement().isInstanceOf(ReturnNode.class);
        assertThat(module.functions().get(0).body()).hasSize(2);
    }

    @Test
    void untranslatableConstructsAreParsedIntoDedicatedNodes() {
        ModuleNode module = parse(
                "def f(x):",
                "    for i in range(x):",
                "        x = x + i",
                "    x += 1",
                "    pass",
                "    y = g(x)",
                "    z = x ** 2",
                "    return");

        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        var body = module.functions().get(0).body();
        assertThat(body).hasSize(6);
        assertThat(body.get(0)).isInstanceOf(LoopNode.class);
        assertThat(((LoopNode) body.get(0)).keyword()).isEqualTo("for");
        assertThat(((UnsupportedStatementNode) body.get(1)).description()).contains("augmented assignment");
        assertThat(((UnsupportedStatementNode) body.get(2)).description()).contains("pass");
        assertThat(((AssignNode) body.get(3)).value()).isInstanceOf(CallNode.class);
        assertThat(((UnsupportedExpressionNode) ((AssignNode) body.get(4)).value()).description()).contains("**");
        assertThat(((UnsupportedStatementNode) body.get(5)).description()).isEqualTo("return without value");
    }

    @Test
    void parsesSeveralFunctions() {
        ModuleNode module = parse(
                "def f(x):",
                "    return x",
                "",
                "def g(y):",
                "    return y");

        assertThat(module.functions()).extracting(FunctionDefNode::name).containsExactly("f", "g");
        assertThat(module.functions().get(1).line()).isEqualTo(4);
    }

    @Test
    void syntaxErrorIsReportedAndParsingResumesAtNextFunction() {
        ModuleNode module = parse(
                "def broken(x):",
                "    return x +",
                "",
                "def fine(y):",
                "    return y");

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(module.functions()).extracting(FunctionDefNode::name).containsExactly("fine");
    }

    @Test
    void statementAtModuleLevelIsASyntaxError() {
        parse("x = 1");

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).contains("Expected 'def' at top level");
    }
}
