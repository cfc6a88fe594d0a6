package org.sportsmcp.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.Callable;

import org.sportsmcp.cli.CommandLineInterface;
import org.sportsmcp.cli.registry.RegistryGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Writes descriptor stubs for every base table of the given schemas.
 * <p>
 * Connection settings default to {@code sports-mcp.database} from configuration. Existing
 * descriptor files are overwritten.
 */
@Command(
    name = "generate-registry",
    description = "Introspect database schemas and write dataset descriptor stubs"
)
public class GenerateRegistryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateRegistryCommand.class);

    @Option(names = {"--jdbc-url"}, description = "JDBC URL (default: sports-mcp.database.jdbcUrl)")
    private String jdbcUrl;

    @Option(names = {"--user"}, description = "Database user (default: sports-mcp.database.username)")
    private String user;

    @Option(names = {"--password"}, description = "Database password (default: sports-mcp.database.password)")
    private String password;

    @Option(names = {"--schemas"}, arity = "1..*", required = true, description = "Schemas to introspect")
    private List<String> schemas;

    @Option(names = {"-o", "--output-dir"}, defaultValue = "registry", description = "Registry directory to write (default: ${DEFAULT-VALUE})")
    private Path outputDir;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Config config = parent.getConfig();
        final String url = jdbcUrl != null ? jdbcUrl : configString(config, "sports-mcp.database.jdbcUrl");
        if (url == null || url.isBlank()) {
            err.println("Error: no JDBC URL given (--jdbc-url or sports-mcp.database.jdbcUrl)");
            return 1;
        }
        final String effectiveUser = user != null ? user : configString(config, "sports-mcp.database.username");
        final String effectivePassword = password != null ? password : configString(config, "sports-mcp.database.password");

        try (Connection connection = DriverManager.getConnection(url, effectiveUser, effectivePassword)) {
            final List<Path> written = new RegistryGenerator().generate(connection, schemas, outputDir);
            for (final Path file : written) {
                out.println("Wrote " + file);
            }
            out.printf("%d descriptor(s) written to %s%n", written.size(), outputDir.toAbsolutePath());
            return 0;
        } catch (SQLException e) {
            log.debug("Introspection failed", e);
            err.println("Database error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.debug("Writing descriptors failed", e);
            err.println("Failed to write descriptors: " + e.getMessage());
            return 1;
        }
    }

    private static String configString(final Config config, final String path) {
        return config.hasPath(path) ? config.getString(path) : null;
    }
}
