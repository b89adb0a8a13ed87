package org.py2smt.translator.diagnostics;

/**
 * A single message (error or warning) raised while preparing a source file
 * for translation.
 *
 * @param type The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The logical name of the source the issue was found in.
 * @param lineNumber The 1-based line of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** Prevents translation of the affected source or function. */
        ERROR,
        /** Reported, but translation continues. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
