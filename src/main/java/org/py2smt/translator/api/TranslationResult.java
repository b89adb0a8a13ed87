package org.py2smt.translator.api;

import org.py2smt.translator.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-function results of translating a whole source file, in source order.
 *
 * @param programName The logical name of the translated source.
 * @param functions One entry per top-level function definition.
 * @param warnings Front-end warnings, e.g. an unterminated docstring.
 */
public record TranslationResult(String programName, List<TranslatedFunction> functions, List<Diagnostic> warnings) {

    public TranslationResult {
        functions = List.copyOf(functions);
        warnings = List.copyOf(warnings);
    }

    /**
     * @return {@code true} if every function was translated.
     */
    public boolean isComplete() {
        return functions.stream().allMatch(TranslatedFunction::succeeded);
    }

    /**
     * @return The functions that failed.
     */
    public List<TranslatedFunction> failures() {
        return functions.stream().filter(f -> !f.succeeded()).collect(Collectors.toList());
    }

    /**
     * Joins the successful translations with newlines, the layout of a
     * translated module.
     *
     * @return The SMT-LIB2 text of all successful functions.
     */
    public String smtText() {
        return functions.stream()
                .filter(TranslatedFunction::succeeded)
                .map(TranslatedFunction::smt)
                .collect(Collectors.joining("\n"));
    }
}
