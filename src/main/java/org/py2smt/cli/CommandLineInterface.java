package org.py2smt.cli;

import com.typesafe.config.Config;
import org.py2smt.cli.commands.TranslateCommand;
import org.py2smt.cli.config.ConfigLoader;
import org.py2smt.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "py2smt",
    mixinStandardHelpOptions = true,
    version = "py2smt 1.0",
    description = "Translates Python functions into SMT-LIB2 define-fun declarations",
    subcommands = {
        TranslateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the picocli command tree with the parser settings of the application.
     *
     * @return A new command line rooted at a fresh {@link CommandLineInterface}.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("py2smt");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The merged configuration.
     * @throws com.typesafe.config.ConfigException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
