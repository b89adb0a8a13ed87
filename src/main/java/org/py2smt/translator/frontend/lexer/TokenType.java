package org.py2smt.translator.frontend.lexer;

/**
 * The token types recognised by the {@link Lexer}.
 */
public enum TokenType {
    // Keywords.
    DEF, RETURN, IF, ELIF, ELSE,
    FOR, WHILE, IN, PASS, BREAK, CONTINUE,
    AND, OR, NOT,
    TRUE, FALSE, NONE,
    /** Any other reserved word, e.g. {@code import} or {@code lambda}. */
    KEYWORD,

    // Literals.
    IDENTIFIER,
    /** An integer literal; the value is a {@link java.math.BigDecimal} with scale 0. */
    INTEGER,
    /** A real literal; the value is a {@link java.math.BigDecimal}. */
    REAL,
    STRING,

    // Operators.
    PLUS, MINUS, STAR, SLASH, PERCENT,
    /** {@code **}, exponentiation. */
    DOUBLE_STAR,
    /** {@code //}, floor division. */
    DOUBLE_SLASH,
    EQUAL_EQUAL, NOT_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    ASSIGN,
    /** {@code +=}, {@code -=} and the other in-place operators. */
    AUGMENTED_ASSIGN,
    /** {@code ->}, introducing a return annotation. */
    ARROW,

    // Punctuation.
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACKET, RIGHT_BRACKET,
    LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON, DOT, SEMICOLON,

    // Layout.
    /** The end of a logical line. */
    NEWLINE,
    /** The indentation level increased. */
    INDENT,
    /** The indentation level decreased by one step. */
    DEDENT,
    END_OF_FILE
}
