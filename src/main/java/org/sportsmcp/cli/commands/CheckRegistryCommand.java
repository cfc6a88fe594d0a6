package org.sportsmcp.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.sportsmcp.cli.CommandLineInterface;
import org.sportsmcp.dataservice.api.registry.DatasetCatalog;
import org.sportsmcp.dataservice.api.registry.DatasetDescriptor;
import org.sportsmcp.dataservice.registry.RegistryLoadException;
import org.sportsmcp.dataservice.registry.RegistryLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Validates the dataset registry without touching the database.
 * <p>
 * Prints one line per dataset; exits with 1 on any load error.
 */
@Command(
    name = "check-registry",
    description = "Load and validate the dataset registry"
)
public class CheckRegistryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckRegistryCommand.class);

    static final String REGISTRY_DIRECTORY_PATH = "sports-mcp.registry.directory";

    @Option(
        names = {"-d", "--directory"},
        description = "Registry directory (default: sports-mcp.registry.directory from configuration)"
    )
    private Path directory;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Path root = directory != null ? directory : configuredDirectory();
        final DatasetCatalog catalog;
        try {
            catalog = new RegistryLoader().load(root);
        } catch (RegistryLoadException e) {
            log.debug("Registry check failed", e);
            err.println("Registry invalid: " + e.getMessage());
            return 1;
        }

        for (final DatasetDescriptor descriptor : catalog.all()) {
            out.printf("%-32s %s.%s (%d columns, key: %s)%n",
                descriptor.getDatasetId(),
                descriptor.getSchema(),
                descriptor.getTable(),
                descriptor.getColumns().size(),
                descriptor.getPrimaryKey().isEmpty() ? "none" : String.join(", ", descriptor.getPrimaryKey()));
        }
        out.printf("%d dataset(s) OK in %s%n", catalog.size(), root.toAbsolutePath());
        return 0;
    }

    private Path configuredDirectory() {
        final var config = parent.getConfig();
        return Path.of(config.hasPath(REGISTRY_DIRECTORY_PATH) ? config.getString(REGISTRY_DIRECTORY_PATH) : "registry");
    }
}
