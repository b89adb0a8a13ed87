package org.py2smt.translator.api;

/**
 * Stable codes for every error the translator can raise.
 * Tests assert on these instead of on message text.
 */
public enum TranslatorErrorCode {
    // region Front-end Errors
    /** The lexer or parser rejected the source text. */
    SYNTAX_ERROR,
    // endregion

    // region Translation Errors
    /** A statement or expression kind outside the translatable grammar. */
    UNSUPPORTED_CONSTRUCT,
    /** A conditional chain without any branch. */
    MALFORMED_CONDITIONAL,
    /** In strict layout, a control-flow path that ends without a return value. */
    MISSING_RETURN_VALUE,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a source file. */
    IO_ERROR_READING_FILE
    // endregion
}
