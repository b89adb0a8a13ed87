package org.py2smt.translator.backend;

import org.py2smt.translator.api.SourceInfo;
import org.py2smt.translator.api.TranslationOptions;
import org.py2smt.translator.api.TypeConfig;
import org.py2smt.translator.frontend.parser.ast.AstNode;

/**
 * Immutable settings shared by the translators of one function.
 * Provides SourceInfo construction for error reporting.
 */
public final class TranslationContext {

    private final String fileName;
    private final TypeConfig types;
    private final TranslationOptions options;

    /**
     * @param fileName The logical source name used in error positions.
     * @param types The sort labels for parameters and return value.
     * @param options The layout and operator switches.
     */
    public TranslationContext(String fileName, TypeConfig types, TranslationOptions options) {
        this.fileName = fileName;
        this.types = types;
        this.options = options;
    }

    public String fileName() {
        return fileName;
    }

    public TypeConfig types() {
        return types;
    }

    public TranslationOptions options() {
        return options;
    }

    /**
     * @return {@code true} if the strict, single-term layout is requested.
     */
    public boolean strict() {
        return options.strict();
    }

    /**
     * Builds a SourceInfo pointing at the given node.
     * @param node The AST node.
     * @return The position of the node in the translated source.
     */
    public SourceInfo sourceOf(AstNode node) {
        return sourceAt(node.line());
    }

    /**
     * @param line A 1-based line number.
     * @return The position of that line in the translated source.
     */
    public SourceInfo sourceAt(int line) {
        return new SourceInfo(fileName, line);
    }
}
