package org.sportsmcp.dataservice.resources.database;

import java.sql.Connection;
import java.sql.SQLException;

import org.sportsmcp.dataservice.api.resources.database.IDatasetReader;
import org.sportsmcp.dataservice.api.resources.database.IDatasetReaderProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * JDBC database resource using HikariCP for connection pooling.
 * <p>
 * Hands out one {@link JdbcDatasetReader} per request. Each reader holds a single pooled
 * connection in a read-only transaction and returns it to the pool when closed.
 * <p>
 * Configuration:
 * <pre>
 * database {
 *   jdbcUrl = "jdbc:postgresql://localhost:5433/sports_dw_dev"
 *   username = "sports_reader"
 *   password = "..."
 *   driverClassName = "org.postgresql.Driver"   # optional, inferred from the URL otherwise
 *   maxPoolSize = 10
 *   minIdle = 2
 *   connectionTimeoutMs = 30000                   # wait for a pooled connection
 *   transactionIsolation = "TRANSACTION_REPEATABLE_READ"   # optional
 *   queryTimeoutSeconds = 0                       # 0 = no statement timeout
 *   initializationFailTimeoutMs = 1               # -1 starts without a reachable database
 * }
 * </pre>
 * <p>
 * Implements {@link AutoCloseable} to ensure proper cleanup of the connection pool during
 * shutdown.
 */
public class JdbcDatabase implements IDatasetReaderProvider, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabase.class);

    private final String name;
    private final HikariDataSource dataSource;
    private final int queryTimeoutSeconds;

    public JdbcDatabase(String name, Config options) {
        this.name = name;

        final String jdbcUrl = getJdbcUrl(options);
        final String username = options.hasPath("username") ? options.getString("username") : "";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        if (options.hasPath("driverClassName")) {
            hikariConfig.setDriverClassName(options.getString("driverClassName"));
        }
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setConnectionTimeout(
            options.hasPath("connectionTimeoutMs") ? options.getLong("connectionTimeoutMs") : 30_000L);
        if (options.hasPath("transactionIsolation")) {
            hikariConfig.setTransactionIsolation(options.getString("transactionIsolation"));
        }
        if (options.hasPath("initializationFailTimeoutMs")) {
            hikariConfig.setInitializationFailTimeout(options.getLong("initializationFailTimeoutMs"));
        }
        hikariConfig.setReadOnly(true);

        // Pool name shows up in HikariCP's own log lines
        hikariConfig.setPoolName(name);

        this.queryTimeoutSeconds = options.hasPath("queryTimeoutSeconds") ? options.getInt("queryTimeoutSeconds") : 0;

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("Database '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (RuntimeException e) {
            Throwable cause = rootCause(e);
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("password") || causeMsg.contains("authentication")) {
                String errorMsg = String.format(
                    "Failed to connect to database '%s': authentication failed. URL=%s, User=%s",
                    name, jdbcUrl, username.isEmpty() ? "(empty)" : username);
                log.error(errorMsg);
                throw new IllegalStateException(errorMsg, e);
            }

            String errorMsg = String.format("Failed to initialize database '%s': %s. URL: %s. Error: %s",
                name, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg, e);
        }
    }

    private static String getJdbcUrl(Config options) {
        if (!options.hasPath("jdbcUrl") || options.getString("jdbcUrl").isBlank()) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for JdbcDatabase.");
        }
        return options.getString("jdbcUrl");
    }

    private static Throwable rootCause(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    @Override
    public IDatasetReader createReader() throws SQLException {
        Connection conn = dataSource.getConnection();
        try {
            conn.setAutoCommit(false);
            return new JdbcDatasetReader(conn, queryTimeoutSeconds);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
    }

    public String getName() {
        return name;
    }

    /**
     * @return number of connections currently checked out of the pool
     */
    public int getActiveConnections() {
        return dataSource.getHikariPoolMXBean() != null
            ? dataSource.getHikariPoolMXBean().getActiveConnections()
            : 0;
    }

    /**
     * Closes the connection pool. Connections still held by open readers are closed when
     * those readers are closed.
     */
    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("Database '{}' connection pool closed", name);
        }
    }
}
