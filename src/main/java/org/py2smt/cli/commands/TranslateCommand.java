package org.py2smt.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.py2smt.cli.CommandLineInterface;
import org.py2smt.cli.config.ConfigLoader;
import org.py2smt.translator.Translator;
import org.py2smt.translator.TranslatorFactory;
import org.py2smt.translator.api.TranslatedFunction;
import org.py2smt.translator.api.TranslationException;
import org.py2smt.translator.api.TranslationOptions;
import org.py2smt.translator.api.TranslationResult;
import org.py2smt.translator.api.TypeConfig;
import org.py2smt.translator.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "translate", description = "Translates the functions of a Python file to SMT-LIB2.")
public class TranslateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TranslateCommand.class);

    /** Exit code when at least one function could not be translated. */
    public static final int EXIT_TRANSLATION_FAILED = 1;
    /** Exit code for configuration and I/O errors. */
    public static final int EXIT_USAGE = 2;

    /** Output formats of the translate command. */
    public enum OutputFormat { SMT, JSON }

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the Python source file.")
    private File file;

    @Option(names = {"-t", "--type"}, description = "Sort of every parameter (default from config: py2smt.types.parameter).")
    private String parameterType;

    @Option(names = {"-r", "--return-type"}, description = "Sort of the return value (default from config: py2smt.types.return).")
    private String returnType;

    @Option(names = "--strict", negatable = true,
            description = "Emit single-term bodies with nested let bindings instead of the legacy sibling layout.")
    private Boolean strict;

    @Option(names = "--division-symbol", description = "SMT-LIB2 function used for '/', e.g. '/' or 'div'.")
    private String divisionSymbol;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private OutputFormat format = OutputFormat.SMT;

    @Option(names = {"-o", "--output"}, description = "Write the output to this file instead of stdout.")
    private File output;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        Translator translator;
        try {
            translator = createTranslator(parent != null ? parent.getConfig() : ConfigLoader.load());
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Cannot read source file {}: {}", file, e.toString());
            err.println("Cannot read source file " + file + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        TranslationResult result;
        try {
            result = translator.translateEach(source, file.getName());
        } catch (TranslationException e) {
            LOG.error("Translation of {} failed [{}]: {}", file, e.getErrorCode(), e.getMessage());
            err.println(e.getMessage());
            return EXIT_TRANSLATION_FAILED;
        }

        for (TranslatedFunction failure : result.failures()) {
            err.println(String.format("%s:%d: %s: %s", file.getName(), failure.line(), failure.name(), failure.error()));
        }

        String text = format == OutputFormat.JSON ? toJson(result) : result.smtText();
        try {
            if (output != null) {
                Files.writeString(output.toPath(), text + System.lineSeparator(), StandardCharsets.UTF_8);
                LOG.info("Wrote {} function(s) to {}", result.functions().size() - result.failures().size(), output);
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.println(text);
                out.flush();
            }
        } catch (IOException e) {
            LOG.error("Cannot write output file {}: {}", output, e.toString());
            err.println("Cannot write output file " + output + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        return result.isComplete() ? 0 : EXIT_TRANSLATION_FAILED;
    }

    /**
     * Builds the translator from configuration, with command-line options taking precedence.
     */
    Translator createTranslator(Config config) {
        Translator configured = TranslatorFactory.fromConfig(config);
        TypeConfig types = new TypeConfig(
                parameterType != null ? parameterType : configured.getTypes().parameterType(),
                returnType != null ? returnType : configured.getTypes().returnType());
        TranslationOptions options = configured.getOptions();
        if (strict != null) {
            options = options.withStrict(strict);
        }
        if (divisionSymbol != null) {
            options = options.withDivisionSymbol(divisionSymbol);
        }
        return new Translator(types, options);
    }

    private String toJson(TranslationResult result) {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(new JsonReport(result.programName(), result.isComplete(), result.functions(), result.warnings()));
    }

    /**
     * Shape of the {@code --format json} document.
     */
    private record JsonReport(String program, boolean complete, List<TranslatedFunction> functions, List<Diagnostic> warnings) {}
}
