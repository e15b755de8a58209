package org.smilesforge.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.smilesforge.cli.commands.RenderCommand;
import org.smilesforge.cli.config.ConfigLoader;
import org.smilesforge.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "smiles-forge",
    mixinStandardHelpOptions = true,
    version = "smiles-forge 1.0",
    description = "smiles-forge - renders molecule ASTs as SMILES line notation",
    subcommands = {
        RenderCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Configuration is read from config/smiles-forge.conf when present.",
        "Any key can be overridden with -Dkey=value, e.g.:",
        "",
        "    JAVA_OPTS=\"-Dsmilesforge.codegen.strict-metadata=true\" bin/smiles-forge render -f mol.json"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/smiles-forge.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand: show usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("smiles-forge");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            throw e;
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("smilesforge.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     *
     * @return The application configuration.
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed or resolved.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
