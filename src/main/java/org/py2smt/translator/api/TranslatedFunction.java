package org.py2smt.translator.api;

/**
 * The outcome of translating one function definition. Exactly one of
 * {@code smt} and {@code error} is set.
 *
 * @param name The function name.
 * @param line The line of the {@code def}.
 * @param smt The {@code define-fun} text, or {@code null} on failure.
 * @param errorCode The error category, or {@code null} on success.
 * @param error The error message, or {@code null} on success.
 */
public record TranslatedFunction(String name, int line, String smt, TranslatorErrorCode errorCode, String error) {

    public static TranslatedFunction success(String name, int line, String smt) {
        return new TranslatedFunction(name, line, smt, null, null);
    }

    public static TranslatedFunction failure(String name, int line, TranslationException cause) {
        return new TranslatedFunction(name, line, null, cause.getErrorCode(), cause.getMessage());
    }

    public boolean succeeded() {
        return smt != null;
    }
}
