package org.py2smt.translator.frontend.lexer;

/**
 * A single token produced by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token in the source.
 * @param value The processed value: a {@link java.math.BigDecimal} for numbers,
 *              the unquoted contents for strings, otherwise {@code null}.
 * @param line The line the token starts on.
 * @param column The column the token starts at.
 * @param fileName The logical source name.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
