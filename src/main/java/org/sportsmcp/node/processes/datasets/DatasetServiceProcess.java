package org.sportsmcp.node.processes.datasets;

import java.nio.file.Path;
import java.util.Map;

import org.sportsmcp.dataservice.api.registry.DatasetCatalog;
import org.sportsmcp.dataservice.api.resources.database.IDatasetReaderProvider;
import org.sportsmcp.dataservice.query.DatasetQueryService;
import org.sportsmcp.dataservice.registry.RegistryLoader;
import org.sportsmcp.dataservice.resources.database.JdbcDatabase;
import org.sportsmcp.node.processes.AbstractProcess;
import org.sportsmcp.node.spi.IServiceProvider;
import org.sportsmcp.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Node process owning the dataset catalog and the database connection pool.
 * <p>
 * The registry is loaded in the constructor, before the pool is opened, so a broken registry
 * aborts node startup without touching the database. The process exposes a
 * {@link ServiceRegistry} holding:
 * <ul>
 *   <li>{@link DatasetCatalog}</li>
 *   <li>{@link IDatasetReaderProvider}</li>
 *   <li>{@link DatasetQueryService}</li>
 * </ul>
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * datasets {
 *   className = "org.sportsmcp.node.processes.datasets.DatasetServiceProcess"
 *   options {
 *     registry.directory = "registry"
 *     database {
 *       jdbcUrl = "jdbc:postgresql://localhost:5433/sports_dw_dev"
 *       username = "sports_reader"
 *       password = ""
 *     }
 *   }
 * }
 * </pre>
 */
public class DatasetServiceProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger log = LoggerFactory.getLogger(DatasetServiceProcess.class);

    private final ServiceRegistry registry = new ServiceRegistry();
    private final DatasetCatalog catalog;
    private final JdbcDatabase database;

    /**
     * Loads the registry and opens the connection pool.
     *
     * @param processName  The name of this process instance from the configuration.
     * @param dependencies Dependencies injected by the Node (none required).
     * @param options      The process options.
     * @throws org.sportsmcp.dataservice.registry.RegistryLoadException if the registry cannot be loaded
     * @throws IllegalArgumentException if the database is not configured
     */
    public DatasetServiceProcess(final String processName, final Map<String, Object> dependencies,
                                 final Config options) {
        super(processName, dependencies, options);

        final Path registryDir = Path.of(options.hasPath("registry.directory")
            ? options.getString("registry.directory")
            : "registry");
        this.catalog = new RegistryLoader().load(registryDir);

        final Config databaseOptions = options.hasPath("database")
            ? options.getConfig("database")
            : ConfigFactory.empty();
        this.database = new JdbcDatabase(processName + "-db", databaseOptions);

        registry.register(DatasetCatalog.class, catalog);
        registry.register(IDatasetReaderProvider.class, database);
        registry.register(DatasetQueryService.class, new DatasetQueryService(catalog, database));
    }

    @Override
    public Object getExposedService() {
        return registry;
    }

    @Override
    public void start() {
        log.info("Dataset service '{}' ready: {} dataset(s) over pool '{}'",
            processName, catalog.size(), database.getName());
    }

    @Override
    public void stop() {
        database.close();
    }
}
