package org.py2smt.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "py2smt.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. System Properties (e.g., -Dpy2smt.translation.strict=true)
     * 2. Environment Variables
     * 3. Configuration File: the explicit file if given, else {@code -Dconfig.file},
     *    else {@code py2smt.conf} in the working directory
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file named on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a named file is missing or cannot be parsed.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig = loadFileConfig(explicitFile);

        // Chain the configs together. The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    /**
     * Loads the configuration from classpath defaults and overrides only.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    private static Config loadFileConfig(final File explicitFile) {
        // 1) Highest precedence: explicit CLI option --config
        if (explicitFile != null) {
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            return parseRequired(explicitFile);
        }

        // 2) Next: standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            LOG.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return parseRequired(systemConfigFile);
        }

        // 3) Then: py2smt.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return parseRequired(cwdConfigFile);
        }

        LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return ConfigFactory.empty();
    }

    private static Config parseRequired(final File file) {
        return ConfigFactory.parseFile(file, ConfigParseOptions.defaults().setAllowMissing(false));
    }
}
