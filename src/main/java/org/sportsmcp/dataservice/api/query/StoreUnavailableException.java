package org.sportsmcp.dataservice.api.query;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

/**
 * Thrown when the relational store cannot serve a query: no connection could be obtained
 * from the pool, or the store rejected or timed out a statement.
 * <p>
 * The whole request fails. No partial page is ever returned and the core does not retry.
 */
public class StoreUnavailableException extends Exception {

    /**
     * @param message description including the dataset that was queried
     * @param cause   the driver or pool failure
     */
    public StoreUnavailableException(String message, SQLException cause) {
        super(message, cause);
    }

    /**
     * Returns whether the failure was a timeout while waiting for a pooled connection.
     * <p>
     * HikariCP signals pool exhaustion with {@link SQLTransientConnectionException}.
     *
     * @return true if the pool could not supply a connection in time
     */
    public boolean isPoolExhausted() {
        return getCause() instanceof SQLTransientConnectionException;
    }
}
