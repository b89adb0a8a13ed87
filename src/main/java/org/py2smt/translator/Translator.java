package org.py2smt.translator;

import org.py2smt.translator.api.ITranslator;
import org.py2smt.translator.api.TranslatedFunction;
import org.py2smt.translator.api.TranslationException;
import org.py2smt.translator.api.TranslationOptions;
import org.py2smt.translator.api.TranslationResult;
import org.py2smt.translator.api.TranslatorErrorCode;
import org.py2smt.translator.api.TypeConfig;
import org.py2smt.translator.backend.FunctionAssembler;
import org.py2smt.translator.backend.TranslationContext;
import org.py2smt.translator.diagnostics.DiagnosticsEngine;
import org.py2smt.translator.diagnostics.TranslatorLogger;
import org.py2smt.translator.frontend.lexer.Lexer;
import org.py2smt.translator.frontend.lexer.Token;
import org.py2smt.translator.frontend.parser.Parser;
import org.py2smt.translator.frontend.parser.ast.FunctionDefNode;
import org.py2smt.translator.frontend.parser.ast.ModuleNode;
import org.py2smt.translator.frontend.preprocessor.PreProcessor;
import org.py2smt.translator.smt.SmtWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The main translator implementation. Runs the pipeline from Python source
 * text to SMT-LIB2 {@code define-fun} forms.
 * <p>
 * Instances hold only immutable settings and may be shared between threads;
 * every call gets its own diagnostics.
 */
public class Translator implements ITranslator {

    private static final Logger LOG = LoggerFactory.getLogger(Translator.class);
    private static final String UNNAMED = "<memory>";

    private final TypeConfig types;
    private final TranslationOptions options;

    /**
     * Creates a translator with {@code Int} sorts and the legacy layout.
     */
    public Translator() {
        this(TypeConfig.DEFAULT, TranslationOptions.DEFAULT);
    }

    /**
     * @param types The sort labels written into every {@code define-fun}.
     * @param options The layout and operator switches.
     */
    public Translator(TypeConfig types, TranslationOptions options) {
        this.types = Objects.requireNonNull(types, "types");
        this.options = Objects.requireNonNull(options, "options");
    }

    public TypeConfig getTypes() {
        return types;
    }

    public TranslationOptions getOptions() {
        return options;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String translate(String source, String programName) throws TranslationException {
        String name = programName == null ? UNNAMED : programName;
        ModuleNode module = parse(source, name, new DiagnosticsEngine());

        List<String> out = new ArrayList<>();
        for (FunctionDefNode function : module.functions()) {
            out.add(translateFunction(function, name));
        }
        TranslatorLogger.debug("Translator: " + name + " functions:" + out.size());
        return String.join("\n", out);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public TranslationResult translateEach(String source, String programName) throws TranslationException {
        String name = programName == null ? UNNAMED : programName;
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ModuleNode module = parse(source, name, diagnostics);

        List<TranslatedFunction> results = new ArrayList<>();
        for (FunctionDefNode function : module.functions()) {
            try {
                results.add(TranslatedFunction.success(function.name(), function.line(), translateFunction(function, name)));
            } catch (TranslationException e) {
                LOG.warn("Function '{}' not translated: {}", function.name(), e.getMessage());
                results.add(TranslatedFunction.failure(function.name(), function.line(), e));
            }
        }
        return new TranslationResult(name, results, diagnostics.getWarnings());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String translateFunction(FunctionDefNode function) throws TranslationException {
        return translateFunction(function, UNNAMED);
    }

    private String translateFunction(FunctionDefNode function, String programName) throws TranslationException {
        TranslationContext ctx = new TranslationContext(programName, types, options);
        String smt = SmtWriter.write(new FunctionAssembler(ctx).assemble(function));
        TranslatorLogger.trace("Translator: " + function.name() + " -> " + smt);
        return smt;
    }

    /**
     * Runs the front end: comment removal, tokenizing and parsing.
     */
    private ModuleNode parse(String source, String programName, DiagnosticsEngine diagnostics) throws TranslationException {
        Objects.requireNonNull(source, "source");

        // Phase 1: Comment removal
        String stripped = new PreProcessor(diagnostics, programName).stripComments(source);

        // Phase 2: Lexical Analysis
        List<Token> tokens = new Lexer(stripped, diagnostics, programName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new TranslationException(TranslatorErrorCode.SYNTAX_ERROR, diagnostics.summary());
        }

        // Phase 3: Parsing
        ModuleNode module = new Parser(tokens, diagnostics).parseModule();
        if (diagnostics.hasErrors()) {
            throw new TranslationException(TranslatorErrorCode.SYNTAX_ERROR, diagnostics.summary());
        }
        TranslatorLogger.debug("Translator: " + programName + " parsed " + module.functions().size() + " function(s)");
        return module;
    }
}
