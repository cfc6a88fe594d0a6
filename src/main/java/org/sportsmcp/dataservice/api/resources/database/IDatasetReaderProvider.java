package org.sportsmcp.dataservice.api.resources.database;

import java.sql.SQLException;

/**
 * Factory for per-request {@link IDatasetReader} instances.
 * <p>
 * Implementations own the connection pool. Acquisition may block while the pool is
 * exhausted, up to the pool's connection timeout.
 */
public interface IDatasetReaderProvider {

    /**
     * Acquires a pooled connection and wraps it in a reader.
     *
     * @return a reader that must be closed by the caller
     * @throws SQLException if no connection could be obtained
     */
    IDatasetReader createReader() throws SQLException;
}
