package org.py2smt.translator.frontend.lexer;

import org.py2smt.translator.diagnostics.DiagnosticsEngine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Converts Python source text into a sequence of tokens.
 * <p>
 * Besides ordinary tokens the lexer produces the layout tokens the parser
 * needs for Python's indentation-based blocks: {@link TokenType#NEWLINE} at
 * the end of every logical line, {@link TokenType#INDENT} when a line is
 * indented deeper than the previous one and one {@link TokenType#DEDENT} per
 * closed indentation level. Blank lines and line breaks inside brackets do
 * not produce layout tokens.
 */
public class Lexer {

    private static final int TAB_SIZE = 8;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("def", TokenType.DEF),
            Map.entry("return", TokenType.RETURN),
            Map.entry("if", TokenType.IF),
            Map.entry("elif", TokenType.ELIF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("while", TokenType.WHILE),
            Map.entry("in", TokenType.IN),
            Map.entry("pass", TokenType.PASS),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("True", TokenType.TRUE),
            Map.entry("False", TokenType.FALSE),
            Map.entry("None", TokenType.NONE)
    );

    private static final List<String> OTHER_RESERVED_WORDS = List.of(
            "as", "assert", "async", "await", "class", "del", "except", "finally", "from",
            "global", "import", "is", "lambda", "nonlocal", "raise", "try", "with", "yield"
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStartOffset = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the source, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.indentStack.push(0);
    }

    /**
     * Tokenizes the entire source.
     * @return The tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0) {
                readIndentation();
                continue;
            }
            start = current;
            scanToken();
        }

        start = current;
        if (!tokens.isEmpty() && lastType() != TokenType.NEWLINE && lastType() != TokenType.DEDENT) {
            addToken(TokenType.NEWLINE, null, "");
        }
        while (indentStack.peek() > 0) {
            indentStack.pop();
            addToken(TokenType.DEDENT, null, "");
        }
        addToken(TokenType.END_OF_FILE, null, "");
        return tokens;
    }

    /**
     * Measures the indentation of the line starting at {@code current} and emits
     * INDENT/DEDENT tokens. Blank lines are consumed without emitting anything.
     */
    private void readIndentation() {
        int width = 0;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
            char c = advance();
            if (c == ' ') width++;
            else if (c == '\t') width = (width / TAB_SIZE + 1) * TAB_SIZE;
        }

        if (isAtEnd()) return;
        char c = peek();
        if (c == '\r' || c == '\n' || c == '#') {
            // blank or comment-only line
            while (!isAtEnd() && peek() != '\n') advance();
            if (!isAtEnd()) {
                advance();
                newLine();
            }
            return;
        }

        atLineStart = false;
        start = current;
        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            addToken(TokenType.INDENT, null, "");
        } else if (width < top) {
            while (width < indentStack.peek()) {
                indentStack.pop();
                addToken(TokenType.DEDENT, null, "");
            }
            if (width != indentStack.peek()) {
                diagnostics.reportError("Unindent does not match any outer indentation level", logicalFileName, line);
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\f' -> { }
            case '\n' -> {
                if (bracketDepth == 0) {
                    addToken(TokenType.NEWLINE, null, "");
                    atLineStart = true;
                }
                newLine();
            }
            case '\\' -> {
                match('\r');
                if (match('\n')) {
                    newLine();
                } else {
                    diagnostics.reportError("Unexpected character after line continuation", logicalFileName, line);
                }
            }
            case '#' -> {
                while (peek() != '\n' && !isAtEnd()) advance();
            }
            case '(' -> openBracket(TokenType.LEFT_PAREN);
            case '[' -> openBracket(TokenType.LEFT_BRACKET);
            case '{' -> openBracket(TokenType.LEFT_BRACE);
            case ')' -> closeBracket(TokenType.RIGHT_PAREN);
            case ']' -> closeBracket(TokenType.RIGHT_BRACKET);
            case '}' -> closeBracket(TokenType.RIGHT_BRACE);
            case ',' -> addToken(TokenType.COMMA);
            case ':' -> addToken(TokenType.COLON);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '+' -> addToken(match('=') ? TokenType.AUGMENTED_ASSIGN : TokenType.PLUS);
            case '-' -> {
                if (match('>')) addToken(TokenType.ARROW);
                else addToken(match('=') ? TokenType.AUGMENTED_ASSIGN : TokenType.MINUS);
            }
            case '*' -> {
                TokenType type = match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR;
                addToken(match('=') ? TokenType.AUGMENTED_ASSIGN : type);
            }
            case '/' -> {
                TokenType type = match('/') ? TokenType.DOUBLE_SLASH : TokenType.SLASH;
                addToken(match('=') ? TokenType.AUGMENTED_ASSIGN : type);
            }
            case '%' -> addToken(match('=') ? TokenType.AUGMENTED_ASSIGN : TokenType.PERCENT);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
            case '!' -> {
                if (match('=')) addToken(TokenType.NOT_EQUAL);
                else diagnostics.reportError("Unexpected character: !", logicalFileName, line);
            }
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '"', '\'' -> string(c);
            case '.' -> {
                if (isDigit(peek())) number();
                else addToken(TokenType.DOT);
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, logicalFileName, line);
                }
            }
        }
    }

    private void openBracket(TokenType type) {
        bracketDepth++;
        addToken(type);
    }

    private void closeBracket(TokenType type) {
        if (bracketDepth > 0) bracketDepth--;
        addToken(type);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            type = OTHER_RESERVED_WORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        }
        addToken(type);
    }

    private void number() {
        if (previous() == '0' && isRadixPrefix(peek())) {
            radixNumber();
            return;
        }

        boolean real = previous() == '.';
        while (isDigit(peek()) || peek() == '_') advance();
        if (!real && peek() == '.') {
            real = true;
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (isDigit(peek())) {
                real = true;
                while (isDigit(peek()) || peek() == '_') advance();
            } else {
                current = mark;
            }
        }
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            diagnostics.reportError("Invalid number literal: " + source.substring(start, current), logicalFileName, line);
            return;
        }

        String text = source.substring(start, current);
        try {
            BigDecimal value = new BigDecimal(text.replace("_", ""));
            addToken(real ? TokenType.REAL : TokenType.INTEGER, value, text);
        } catch (NumberFormatException e) {
            diagnostics.reportError("Invalid number literal: " + text, logicalFileName, line);
        }
    }

    private void radixNumber() {
        char prefix = Character.toLowerCase(advance());
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        int radix = switch (prefix) {
            case 'x' -> 16;
            case 'o' -> 8;
            default -> 2;
        };
        String digits = text.substring(2).replace("_", "");
        try {
            if (digits.isEmpty()) throw new NumberFormatException("Empty numeric literal");
            BigDecimal value = new BigDecimal(new BigInteger(digits, radix));
            addToken(TokenType.INTEGER, value, text);
        } catch (NumberFormatException e) {
            diagnostics.reportError("Invalid number literal: " + text, logicalFileName, line);
        }
    }

    private void string(char quote) {
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        }
        int contentStart = current;
        while (!isAtEnd()) {
            char c = peek();
            if (!triple && c == '\n') break;
            if (c == '\\' && current + 1 < source.length()) {
                advance();
                if (advance() == '\n') newLine();
                continue;
            }
            if (c == quote && (!triple || (peekNext() == quote && peekAt(2) == quote))) {
                String value = source.substring(contentStart, current);
                advance();
                if (triple) {
                    advance();
                    advance();
                }
                addToken(TokenType.STRING, value, source.substring(start, current));
                return;
            }
            advance();
            if (c == '\n') newLine();
        }
        diagnostics.reportError("Unterminated string", logicalFileName, line);
    }

    private void newLine() {
        line++;
        lineStartOffset = current;
    }

    private void addToken(TokenType type) {
        addToken(type, null, source.substring(start, current));
    }

    private void addToken(TokenType type, Object value, String text) {
        tokens.add(new Token(type, text, value, line, start - lineStartOffset + 1, logicalFileName));
    }

    private TokenType lastType() {
        return tokens.get(tokens.size() - 1).type();
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isRadixPrefix(char c) {
        return c == 'x' || c == 'X' || c == 'o' || c == 'O' || c == 'b' || c == 'B';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
