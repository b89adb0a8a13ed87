package org.py2smt.translator.frontend.parser;

import org.py2smt.translator.diagnostics.DiagnosticsEngine;
import org.py2smt.translator.frontend.lexer.Token;
import org.py2smt.translator.frontend.lexer.TokenType;
import org.py2smt.translator.frontend.parser.ast.AssignNode;
import org.py2smt.translator.frontend.parser.ast.BinaryOpNode;
import org.py2smt.translator.frontend.parser.ast.BinaryOperator;
import org.py2smt.translator.frontend.parser.ast.BooleanLiteralNode;
import org.py2smt.translator.frontend.parser.ast.CallNode;
import org.py2smt.translator.frontend.parser.ast.ConditionalNode;
import org.py2smt.translator.frontend.parser.ast.Expression;
import org.py2smt.translator.frontend.parser.ast.ExpressionStatementNode;
import org.py2smt.translator.frontend.parser.ast.FunctionDefNode;
import org.py2smt.translator.frontend.parser.ast.IdentifierNode;
import org.py2smt.translator.frontend.parser.ast.LoopNode;
import org.py2smt.translator.frontend.parser.ast.ModuleNode;
import org.py2smt.translator.frontend.parser.ast.NumberLiteralNode;
import org.py2smt.translator.frontend.parser.ast.ParameterNode;
import org.py2smt.translator.frontend.parser.ast.ReturnNode;
import org.py2smt.translator.frontend.parser.ast.Statement;
import org.py2smt.translator.frontend.parser.ast.StringLiteralNode;
import org.py2smt.translator.frontend.parser.ast.UnaryOpNode;
import org.py2smt.translator.frontend.parser.ast.UnaryOperator;
import org.py2smt.translator.frontend.parser.ast.UnsupportedExpressionNode;
import org.py2smt.translator.frontend.parser.ast.UnsupportedStatementNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the Python subset. It consumes the tokens of
 * the {@link org.py2smt.translator.frontend.lexer.Lexer} and produces one
 * {@link FunctionDefNode} per top-level {@code def}.
 * <p>
 * Constructs that are valid Python but cannot be translated (loops, calls,
 * {@code pass}, augmented assignment, ...) are not syntax errors: they are
 * parsed into dedicated nodes so the translator can reject them by name.
 * Real syntax errors are reported to the {@link DiagnosticsEngine}; the parser
 * then skips to the next top-level {@code def}.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;
    private int indentDepth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by END_OF_FILE.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the whole token stream.
     * @return The module with all function definitions that parsed cleanly.
     */
    public ModuleNode parseModule() {
        List<FunctionDefNode> functions = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            try {
                if (!check(TokenType.DEF)) {
                    throw error(peek(), "Expected 'def' at top level");
                }
                functions.add(functionDef());
            } catch (ParseError ex) {
                synchronize();
            }
        }
        return new ModuleNode(functions);
    }

    // ---------- declarations ----------

    private FunctionDefNode functionDef() {
        Token def = consume(TokenType.DEF, "Expected 'def'");
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name");
        List<ParameterNode> parameters = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (check(TokenType.RIGHT_PAREN)) break;
                parameters.add(parameter());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");
        if (match(TokenType.ARROW)) {
            // return annotation; sorts come from the type configuration
            expression();
        }
        consume(TokenType.COLON, "Expected ':' after function signature");
        List<Statement> body = block();
        return new FunctionDefNode(name.text(), parameters, body, def.line());
    }

    private ParameterNode parameter() {
        if (check(TokenType.STAR) || check(TokenType.DOUBLE_STAR) || check(TokenType.SLASH)) {
            throw error(peek(), "Variadic and positional-only parameters are not supported");
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");
        if (match(TokenType.COLON)) {
            expression();
        }
        if (match(TokenType.ASSIGN)) {
            // default value; irrelevant for the logical encoding
            expression();
        }
        return new ParameterNode(name.text(), name.line());
    }

    // ---------- blocks & statements ----------

    private List<Statement> block() {
        List<Statement> statements = new ArrayList<>();
        if (!match(TokenType.NEWLINE)) {
            statements.addAll(simpleStatementLine());
            return statements;
        }
        consume(TokenType.INDENT, "Expected an indented block");
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            statements.addAll(statement());
        }
        consume(TokenType.DEDENT, "Expected end of block");
        return statements;
    }

    private List<Statement> statement() {
        if (check(TokenType.IF)) return List.of(ifStatement());
        if (check(TokenType.FOR) || check(TokenType.WHILE)) return List.of(loop());
        if (check(TokenType.DEF)) {
            FunctionDefNode nested = functionDef();
            return List.of(new UnsupportedStatementNode("nested function definition '" + nested.name() + "'", nested.line()));
        }
        if (check(TokenType.KEYWORD) && isCompoundKeyword(peek().text())) {
            return List.of(unsupportedCompoundStatement());
        }
        return simpleStatementLine();
    }

    private List<Statement> simpleStatementLine() {
        List<Statement> statements = new ArrayList<>();
        statements.add(simpleStatement());
        while (match(TokenType.SEMICOLON)) {
            if (check(TokenType.NEWLINE) || isAtEnd()) break;
            statements.add(simpleStatement());
        }
        if (!isAtEnd()) {
            consume(TokenType.NEWLINE, "Expected end of line");
        }
        return statements;
    }

    private Statement simpleStatement() {
        Token first = peek();
        switch (first.type()) {
            case RETURN -> {
                advance();
                if (atEndOfSimpleStatement()) {
                    return new UnsupportedStatementNode("return without value", first.line());
                }
                Expression value = expression();
                if (check(TokenType.COMMA)) {
                    skipToEndOfSimpleStatement();
                    return new UnsupportedStatementNode("return of a tuple", first.line());
                }
                return new ReturnNode(value, first.line());
            }
            case PASS, BREAK, CONTINUE -> {
                advance();
                return new UnsupportedStatementNode("'" + first.text() + "' statement", first.line());
            }
            case KEYWORD -> {
                skipToEndOfSimpleStatement();
                return new UnsupportedStatementNode("'" + first.text() + "' statement", first.line());
            }
            default -> {
                return expressionOrAssignment();
            }
        }
    }

    private Statement expressionOrAssignment() {
        int line = peek().line();
        Expression target = expression();

        if (check(TokenType.COMMA)) {
            skipToEndOfSimpleStatement();
            return new UnsupportedStatementNode("tuple assignment or expression", line);
        }
        if (match(TokenType.AUGMENTED_ASSIGN)) {
            String operator = previous().text();
            expression();
            return new UnsupportedStatementNode("augmented assignment '" + operator + "'", line);
        }
        if (match(TokenType.COLON)) {
            // annotated assignment: the annotation is ignored
            expression();
            if (!match(TokenType.ASSIGN)) {
                return new UnsupportedStatementNode("annotation without value", line);
            }
            return assignment(target, line);
        }
        if (match(TokenType.ASSIGN)) {
            return assignment(target, line);
        }
        return new ExpressionStatementNode(target, line);
    }

    private Statement assignment(Expression target, int line) {
        Expression value = expression();
        if (check(TokenType.ASSIGN) || check(TokenType.COMMA)) {
            skipToEndOfSimpleStatement();
            return new UnsupportedStatementNode("multiple assignment", line);
        }
        if (!(target instanceof IdentifierNode identifier)) {
            return new UnsupportedStatementNode("assignment to a non-name target", line);
        }
        return new AssignNode(identifier.name(), value, line);
    }

    private ConditionalNode ifStatement() {
        Token ifToken = consume(TokenType.IF, "Expected 'if'");
        List<ConditionalNode.Branch> branches = new ArrayList<>();
        branches.add(branch());
        while (match(TokenType.ELIF)) {
            branches.add(branch());
        }
        List<Statement> elseBody = null;
        if (match(TokenType.ELSE)) {
            consume(TokenType.COLON, "Expected ':' after 'else'");
            elseBody = block();
        }
        return new ConditionalNode(branches, elseBody, ifToken.line());
    }

    private ConditionalNode.Branch branch() {
        Expression condition = expression();
        consume(TokenType.COLON, "Expected ':' after condition");
        return new ConditionalNode.Branch(condition, block());
    }

    private LoopNode loop() {
        Token keyword = advance();
        skipHeaderToColon();
        consume(TokenType.COLON, "Expected ':' after " + keyword.text() + " header");
        List<Statement> body = block();
        if (match(TokenType.ELSE)) {
            consume(TokenType.COLON, "Expected ':' after 'else'");
            block();
        }
        return new LoopNode(keyword.text(), body, keyword.line());
    }

    private UnsupportedStatementNode unsupportedCompoundStatement() {
        Token keyword = advance();
        skipHeaderToColon();
        consume(TokenType.COLON, "Expected ':' after " + keyword.text() + " header");
        block();
        // clauses such as except/finally/else of a try statement
        while (check(TokenType.ELSE) || (check(TokenType.KEYWORD)
                && (peek().text().equals("except") || peek().text().equals("finally")))) {
            advance();
            skipHeaderToColon();
            consume(TokenType.COLON, "Expected ':'");
            block();
        }
        return new UnsupportedStatementNode("'" + keyword.text() + "' statement", keyword.line());
    }

    private boolean isCompoundKeyword(String text) {
        return text.equals("class") || text.equals("try") || text.equals("with") || text.equals("async");
    }

    // ---------- expressions (Python precedence) ----------

    private Expression expression() {
        return or();
    }

    private Expression or() {
        Expression e = and();
        while (match(TokenType.OR)) {
            Expression right = and();
            e = new BinaryOpNode(BinaryOperator.OR, e, right, e.line());
        }
        return e;
    }

    private Expression and() {
        Expression e = not();
        while (match(TokenType.AND)) {
            Expression right = not();
            e = new BinaryOpNode(BinaryOperator.AND, e, right, e.line());
        }
        return e;
    }

    private Expression not() {
        if (match(TokenType.NOT)) {
            Token operator = previous();
            return new UnaryOpNode(UnaryOperator.NOT, not(), operator.line());
        }
        return comparison();
    }

    /**
     * Parses a comparison. A chain {@code a < b < c} means {@code a < b and b < c}.
     */
    private Expression comparison() {
        Expression left = arithmetic();
        Expression result = null;
        while (true) {
            int line = left.line();
            BinaryOperator operator = comparisonOperator();
            Expression right;
            Expression link;
            if (operator != null) {
                right = arithmetic();
                link = new BinaryOpNode(operator, left, right, line);
            } else if (check(TokenType.IN) || (check(TokenType.NOT) && checkNext(TokenType.IN))) {
                match(TokenType.NOT);
                consume(TokenType.IN, "Expected 'in'");
                right = arithmetic();
                link = new UnsupportedExpressionNode("membership test 'in'", line);
            } else if (check(TokenType.KEYWORD) && peek().text().equals("is")) {
                advance();
                match(TokenType.NOT);
                right = arithmetic();
                link = new UnsupportedExpressionNode("identity test 'is'", line);
            } else {
                break;
            }
            result = result == null ? link : new BinaryOpNode(BinaryOperator.AND, result, link, result.line());
            left = right;
        }
        return result == null ? left : result;
    }

    private BinaryOperator comparisonOperator() {
        if (match(TokenType.EQUAL_EQUAL)) return BinaryOperator.EQ;
        if (match(TokenType.NOT_EQUAL)) return BinaryOperator.NE;
        if (match(TokenType.LESS)) return BinaryOperator.LT;
        if (match(TokenType.LESS_EQUAL)) return BinaryOperator.LE;
        if (match(TokenType.GREATER)) return BinaryOperator.GT;
        if (match(TokenType.GREATER_EQUAL)) return BinaryOperator.GE;
        return null;
    }

    private Expression arithmetic() {
        Expression e = term();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator operator = previous().type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            Expression right = term();
            e = new BinaryOpNode(operator, e, right, e.line());
        }
        return e;
    }

    private Expression term() {
        Expression e = factor();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT, TokenType.DOUBLE_SLASH)) {
            TokenType type = previous().type();
            Expression right = factor();
            e = switch (type) {
                case STAR -> new BinaryOpNode(BinaryOperator.MUL, e, right, e.line());
                case SLASH -> new BinaryOpNode(BinaryOperator.DIV, e, right, e.line());
                case PERCENT -> new BinaryOpNode(BinaryOperator.MOD, e, right, e.line());
                default -> new UnsupportedExpressionNode("floor division '//'", e.line());
            };
        }
        return e;
    }

    private Expression factor() {
        if (match(TokenType.MINUS)) {
            Token operator = previous();
            return new UnaryOpNode(UnaryOperator.NEG, factor(), operator.line());
        }
        if (match(TokenType.PLUS)) {
            Token operator = previous();
            factor();
            return new UnsupportedExpressionNode("unary '+'", operator.line());
        }
        return power();
    }

    private Expression power() {
        Expression base = postfix();
        if (match(TokenType.DOUBLE_STAR)) {
            factor();
            return new UnsupportedExpressionNode("exponentiation '**'", base.line());
        }
        return base;
    }

    private Expression postfix() {
        Expression e = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                e = new CallNode(e, arguments(), e.line());
            } else if (match(TokenType.LEFT_BRACKET)) {
                skipBalanced(TokenType.LEFT_BRACKET, TokenType.RIGHT_BRACKET);
                e = new UnsupportedExpressionNode("subscript", e.line());
            } else if (match(TokenType.DOT)) {
                consume(TokenType.IDENTIFIER, "Expected attribute name after '.'");
                e = new UnsupportedExpressionNode("attribute access", e.line());
            } else {
                return e;
            }
        }
    }

    private List<Expression> arguments() {
        List<Expression> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (check(TokenType.RIGHT_PAREN)) break;
                if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
                    // keyword argument
                    advance();
                    advance();
                }
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression primary() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER, REAL -> {
                advance();
                return new NumberLiteralNode((BigDecimal) token.value(), token.type() == TokenType.INTEGER, token.line());
            }
            case TRUE, FALSE -> {
                advance();
                return new BooleanLiteralNode(token.type() == TokenType.TRUE, token.line());
            }
            case NONE -> {
                advance();
                return new UnsupportedExpressionNode("None", token.line());
            }
            case IDENTIFIER -> {
                advance();
                return new IdentifierNode(token.text(), token.line());
            }
            case STRING -> {
                StringBuilder value = new StringBuilder();
                while (match(TokenType.STRING)) {
                    value.append((String) previous().value());
                }
                return new StringLiteralNode(value.toString(), token.line());
            }
            case LEFT_PAREN -> {
                advance();
                if (match(TokenType.RIGHT_PAREN)) {
                    return new UnsupportedExpressionNode("tuple", token.line());
                }
                Expression inner = expression();
                if (check(TokenType.COMMA)) {
                    skipBalanced(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
                    return new UnsupportedExpressionNode("tuple", token.line());
                }
                consume(TokenType.RIGHT_PAREN, "Expected ')'");
                return inner;
            }
            case LEFT_BRACKET -> {
                advance();
                skipBalanced(TokenType.LEFT_BRACKET, TokenType.RIGHT_BRACKET);
                return new UnsupportedExpressionNode("list display", token.line());
            }
            case LEFT_BRACE -> {
                advance();
                skipBalanced(TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE);
                return new UnsupportedExpressionNode("dict or set display", token.line());
            }
            default -> throw error(token, "Expected expression");
        }
    }

    // ---------- skipping ----------

    /**
     * Skips tokens up to and including the bracket closing the one just consumed.
     */
    private void skipBalanced(TokenType open, TokenType close) {
        int depth = 1;
        while (!isAtEnd()) {
            Token t = advance();
            if (t.type() == open) depth++;
            else if (t.type() == close && --depth == 0) return;
        }
        throw error(peek(), "Expected '" + closingText(close) + "'");
    }

    private String closingText(TokenType close) {
        return switch (close) {
            case RIGHT_PAREN -> ")";
            case RIGHT_BRACKET -> "]";
            default -> "}";
        };
    }

    private void skipHeaderToColon() {
        int depth = 0;
        while (!isAtEnd() && !check(TokenType.NEWLINE)) {
            TokenType type = peek().type();
            if (depth == 0 && type == TokenType.COLON) return;
            if (type == TokenType.LEFT_PAREN || type == TokenType.LEFT_BRACKET || type == TokenType.LEFT_BRACE) depth++;
            if (type == TokenType.RIGHT_PAREN || type == TokenType.RIGHT_BRACKET || type == TokenType.RIGHT_BRACE) depth--;
            advance();
        }
    }

    private void skipToEndOfSimpleStatement() {
        while (!atEndOfSimpleStatement()) advance();
    }

    private boolean atEndOfSimpleStatement() {
        return isAtEnd() || check(TokenType.NEWLINE) || check(TokenType.SEMICOLON);
    }

    /**
     * Skips to the next {@code def} at the outermost indentation level.
     */
    private void synchronize() {
        while (!isAtEnd()) {
            if (indentDepth <= 0 && check(TokenType.DEF)
                    && (current == 0 || previous().type() == TokenType.NEWLINE || previous().type() == TokenType.DEDENT)) {
                indentDepth = 0;
                return;
            }
            advance();
        }
    }

    // ---------- helpers ----------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            Token t = tokens.get(current++);
            if (t.type() == TokenType.INDENT) indentDepth++;
            else if (t.type() == TokenType.DEDENT) indentDepth--;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private ParseError error(Token token, String message) {
        String where = token.type() == TokenType.END_OF_FILE ? "end of input" : "'" + token.text() + "'";
        diagnostics.reportError(message + " (at " + where + ")", token.fileName(), token.line());
        return new ParseError(message);
    }

    /**
     * Unwinds the parser to the next synchronisation point. The diagnostic has
     * already been reported when this is thrown.
     */
    private static class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message);
        }
    }
}
