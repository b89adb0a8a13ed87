package org.py2smt.translator.api;

import org.py2smt.translator.frontend.parser.ast.FunctionDefNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Public interface of the Python-to-SMT-LIB2 translator.
 */
public interface ITranslator {

    /**
     * Translates every function in the source. The first error aborts the
     * whole run and no output is returned.
     *
     * @param source The Python source text.
     * @param programName A logical name used in diagnostics.
     * @return The {@code define-fun} forms, one per function, joined with newlines.
     * @throws TranslationException if the source cannot be parsed or any function cannot be translated.
     */
    String translate(String source, String programName) throws TranslationException;

    /**
     * Translates each function independently; a failing function does not
     * affect the others.
     *
     * @param source The Python source text.
     * @param programName A logical name used in diagnostics.
     * @return The per-function results.
     * @throws TranslationException if the source cannot be parsed at all.
     */
    TranslationResult translateEach(String source, String programName) throws TranslationException;

    /**
     * Translates one already parsed function definition.
     *
     * @param function The function.
     * @return The {@code define-fun} text.
     * @throws TranslationException if the body uses a construct outside the translatable grammar.
     */
    String translateFunction(FunctionDefNode function) throws TranslationException;

    /**
     * Translates a source file from disk.
     *
     * @param sourcePath The path of the Python file.
     * @return The translated module.
     * @throws TranslationException if translation fails.
     * @throws IOException if the file cannot be read.
     */
    default String translate(Path sourcePath) throws TranslationException, IOException {
        return translate(Files.readString(sourcePath), sourcePath.toString());
    }
}
