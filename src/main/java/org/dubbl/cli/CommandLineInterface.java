package org.dubbl.cli;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.function.Function;

import org.dubbl.archive.H2GameArchive;
import org.dubbl.archive.IGameArchive;
import org.dubbl.cli.commands.LeaderboardCommand;
import org.dubbl.cli.commands.ReplayCommand;
import org.dubbl.cli.commands.ScoreCommand;
import org.dubbl.cli.config.ConfigLoader;
import org.dubbl.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "dubbl",
    mixinStandardHelpOptions = true,
    version = "dubbl 1.0",
    description = "dubbl - live scoring and statistics for bat-and-ball games",
    subcommands = {
        ScoreCommand.class,
        LeaderboardCommand.class,
        ReplayCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Configuration is read from --config, -Dconfig.file, config/dubbl.conf",
        "or the installation directory, in that order."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/dubbl.conf)"
    )
    private File configFile;

    private final Function<Config, IGameArchive> archiveFactory;

    private Config config;
    private boolean initialized = false;

    public CommandLineInterface() {
        this(H2GameArchive::new);
    }

    /**
     * @param archiveFactory Opens the archive from the {@code archive} config block.
     */
    public CommandLineInterface(Function<Config, IGameArchive> archiveFactory) {
        this.archiveFactory = archiveFactory;
    }

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
        return createCommandLine(new CommandLineInterface());
    }

    /**
     * Creates a CommandLine around the given root command, e.g. one with a
     * custom archive factory.
     */
    public static CommandLine createCommandLine(CommandLineInterface root) {
        final CommandLine commandLine = new CommandLine(root);
        commandLine.setCommandName("dubbl");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("dubbl.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
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
     * @throws IllegalArgumentException             if an explicit config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Opens the game archive configured under {@code archive}.
     */
    public IGameArchive openArchive() {
        return archiveFactory.apply(getConfig().getConfig("archive"));
    }
}
