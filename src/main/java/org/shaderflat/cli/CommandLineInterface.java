package org.shaderflat.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.shaderflat.cli.commands.KindsCommand;
import org.shaderflat.cli.commands.PreprocessCommand;
import org.shaderflat.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "shaderflat",
    mixinStandardHelpOptions = true,
    version = "shaderflat 1.0",
    description = "Flattens GLSL shader sources: resolves #include, include guards and #pragma once.",
    subcommands = {
        PreprocessCommand.class,
        KindsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    static final String CONFIG_FILE_NAME = "shaderflat.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: shaderflat.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // no subcommand: show the help message
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("shaderflat");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        try {
            this.config = loadConfig();
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private Config loadConfig() {
        // 1) explicit --config option
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return withDefaults(ConfigFactory.parseFile(this.configFile));
        }

        // 2) standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
            }
            LOG.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return withDefaults(ConfigFactory.parseFile(systemConfigFile));
        }

        // 3) shaderflat.conf in the working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return withDefaults(ConfigFactory.parseFile(cwdConfigFile));
        }

        // 4) classpath defaults only
        LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return withDefaults(ConfigFactory.empty());
    }

    /**
     * Config load order: System Props > Env Vars > File > Classpath defaults.
     */
    private static Config withDefaults(Config file) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(file)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
