package org.sportsmcp.dataservice.api.resources.database;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import org.sportsmcp.dataservice.api.query.SqlStatement;

/**
 * Per-request reader over the relational store.
 * <p>
 * Holds one pooled connection inside a read-only transaction, so every statement executed
 * through the same reader sees the same snapshot (subject to the configured isolation level).
 * MUST be used with try-with-resources to ensure the connection returns to the pool.
 */
public interface IDatasetReader extends AutoCloseable {

    /**
     * Executes a scalar count statement.
     *
     * @param statement a statement returning one row with one numeric column
     * @return the count, or 0 if the statement returned no row; never negative
     * @throws SQLException if the statement fails
     */
    long count(SqlStatement statement) throws SQLException;

    /**
     * Executes a row-fetch statement.
     *
     * @param statement a statement selecting exactly {@code columns}, in that order
     * @param columns   the projected column names, used as map keys
     * @return one ordered map per row, keys in {@code columns} order
     * @throws SQLException if the statement fails
     */
    List<Map<String, Object>> fetch(SqlStatement statement, List<String> columns) throws SQLException;

    /**
     * Ends the transaction and returns the connection to the pool.
     */
    @Override
    void close();
}
