package org.pysymphony.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.pysymphony.cli.commands.AuditCommand;
import org.pysymphony.cli.commands.MergeCommand;
import org.pysymphony.cli.config.ConfigLoader;
import org.pysymphony.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "pysymphony",
    mixinStandardHelpOptions = true,
    version = "pysymphony 1.0",
    description = "Merges multi-module Python programs into a single file and audits single-file programs",
    subcommands = {
        MergeCommand.class,
        AuditCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes:",
        "  0  success",
        "  1  the input could not be merged or read",
        "  2  the audit found errors"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/pysymphony.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
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
        commandLine.setCommandName("pysymphony");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration is invalid.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final Config loaded = ConfigLoader.resolve(configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.warn(message);
            }
        });

        if (loaded.hasPath("logging.format")) {
            final String format = loaded.getString("logging.format");
            System.setProperty("pysymphony.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(loaded);

        config = loaded;
        return config;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext context)) {
            return;
        }
        final java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
