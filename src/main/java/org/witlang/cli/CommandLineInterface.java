package org.witlang.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.witlang.cli.commands.CompileCommand;
import org.witlang.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "witc",
    mixinStandardHelpOptions = true,
    version = "witc 1.0",
    description = "witc - compiles Wit programs to x86-64 NASM assembly",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "witc.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: witc.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Creates the picocli command line with all subcommands registered.
     * @return A ready-to-execute command line.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("witc");
        return commandLine;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Returns the effective configuration, loading it and applying the logging settings on first use.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if a configuration file was named but does not exist or cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private Config loadConfig() {
        File file = resolveConfigFile();
        try {
            // Config load order: System Props > Env Vars > File > Classpath defaults
            Config base = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                base = base.withFallback(ConfigFactory.parseFile(file));
            }
            return base.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    private File resolveConfigFile() {
        // 1) Highest precedence: explicit CLI option --config
        if (configFile != null) {
            requireExists(configFile, "--config");
            LOGGER.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            return configFile;
        }
        // 2) Next: standard Typesafe Config system property -Dconfig.file
        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExists(systemConfigFile, "-Dconfig.file");
            LOGGER.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return systemConfigFile;
        }
        // 3) Then: witc.conf in the current working directory
        File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            LOGGER.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }
        // 4) Finally: classpath defaults only
        LOGGER.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
    }

    private void requireExists(File file, String origin) {
        if (!file.exists()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via " + origin + " was not found: " + file.getAbsolutePath());
        }
    }
}
