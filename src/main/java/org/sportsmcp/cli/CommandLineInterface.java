package org.sportsmcp.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.sportsmcp.cli.commands.CheckRegistryCommand;
import org.sportsmcp.cli.commands.GenerateRegistryCommand;
import org.sportsmcp.cli.commands.ServeCommand;
import org.sportsmcp.cli.config.ConfigLoader;
import org.sportsmcp.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "sports-mcp",
    mixinStandardHelpOptions = true,
    version = "Sports MCP Server 1.0",
    description = "Read-only query service over curated sports datasets",
    subcommands = {
        ServeCommand.class,
        CheckRegistryCommand.class,
        GenerateRegistryCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Environment:",
        "  SPORTS_MCP_JDBC_URL, SPORTS_MCP_DB_USER, SPORTS_MCP_DB_PASSWORD,",
        "  SPORTS_MCP_REGISTRY_DIR and SPORTS_MCP_PORT override the built-in defaults."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOGGING_FORMAT_PROPERTY = "sportsmcp.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/sports-mcp.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with all subcommands. Tests use this to run commands the same
     * way {@link #main(String[])} does.
     *
     * @return a configured CommandLine instance
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("sports-mcp");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            applyLogging(config);
        }
        return config;
    }

    private Config loadConfig() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        try {
            return ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    private static void applyLogging(final Config config) {
        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
    }

    /**
     * Reloads {@code logback.xml} so the appender selected through
     * {@value #LOGGING_FORMAT_PROPERTY} takes effect. Keeps the current setup when Logback is not
     * the bound backend or the file is absent (tests run with {@code logback-test.xml}).
     */
    private static void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        final ClassLoader classLoader = CommandLineInterface.class.getClassLoader();
        final URL configUrl = classLoader.getResource("logback.xml");
        if (configUrl == null || classLoader.getResource("logback-test.xml") != null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
