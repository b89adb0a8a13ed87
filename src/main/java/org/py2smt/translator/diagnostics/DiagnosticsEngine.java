package org.py2smt.translator.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics produced by the preprocessor, lexer and parser of
 * one translation run.
 * <p>
 * The front-end phases report here instead of throwing, so that all problems
 * of a source file can be shown at once.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The source in which the error occurred.
     * @param lineNumber The line of the error.
     */
    public void reportError(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The source in which the warning occurred.
     * @param lineNumber The line of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return An unmodifiable view of all collected diagnostics, in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return Only the warnings, in report order.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.WARNING)
                .collect(Collectors.toList());
    }

    /**
     * Returns all collected diagnostics as a single string, one per line.
     *
     * @return A formatted summary.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
