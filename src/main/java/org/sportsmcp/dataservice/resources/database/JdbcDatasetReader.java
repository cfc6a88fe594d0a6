package org.sportsmcp.dataservice.resources.database;

import java.sql.Array;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.sportsmcp.dataservice.api.query.SqlStatement;
import org.sportsmcp.dataservice.api.resources.database.IDatasetReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-request dataset reader over a JDBC connection.
 * <p>
 * The connection arrives with auto-commit disabled, so the count and the fetch of one
 * request run in the same transaction. The transaction is rolled back on close; readers
 * never write.
 */
public class JdbcDatasetReader implements IDatasetReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatasetReader.class);

    private final Connection connection;
    private final int queryTimeoutSeconds;
    private boolean closed = false;

    public JdbcDatasetReader(Connection connection, int queryTimeoutSeconds) {
        this.connection = connection;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public long count(SqlStatement statement) throws SQLException {
        ensureNotClosed();

        try (PreparedStatement stmt = prepare(statement);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                log.debug("Count statement returned no row, treating as 0: {}", statement.sql());
                return 0L;
            }
            long count = rs.getLong(1);
            return Math.max(0L, count);
        }
    }

    @Override
    public List<Map<String, Object>> fetch(SqlStatement statement, List<String> columns) throws SQLException {
        ensureNotClosed();

        List<Map<String, Object>> rows = new ArrayList<>();
        try (PreparedStatement stmt = prepare(statement);
             ResultSet rs = stmt.executeQuery()) {
            int columnCount = rs.getMetaData().getColumnCount();
            if (columnCount != columns.size()) {
                throw new SQLException("Fetch returned " + columnCount + " columns, expected " + columns.size());
            }
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>(columns.size() * 2);
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), toJsonValue(rs.getObject(i + 1)));
                }
                rows.add(row);
            }
        }
        return rows;
    }

    private PreparedStatement prepare(SqlStatement statement) throws SQLException {
        PreparedStatement stmt = connection.prepareStatement(statement.sql());
        try {
            if (queryTimeoutSeconds > 0) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
            }
            List<Object> parameters = statement.parameters();
            for (int i = 0; i < parameters.size(); i++) {
                Object value = parameters.get(i);
                if (value == null) {
                    stmt.setNull(i + 1, Types.NULL);
                } else {
                    stmt.setObject(i + 1, value);
                }
            }
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    /**
     * Converts driver-specific values into types that serialize cleanly to JSON.
     * <p>
     * Temporal values become ISO-8601 strings; numbers, strings and booleans pass through.
     */
    static Object toJsonValue(Object value) throws SQLException {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean) {
            return value;
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof java.sql.Time time) {
            return time.toLocalTime().toString();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof Clob clob) {
            long length = clob.length();
            return length == 0 ? "" : clob.getSubString(1, Math.toIntExact(length));
        }
        if (value instanceof Array array) {
            Object[] elements = (Object[]) array.getArray();
            List<Object> converted = new ArrayList<>(elements.length);
            for (Object element : elements) {
                converted.add(toJsonValue(element));
            }
            return converted;
        }
        if (value instanceof Object[] elements) {
            List<Object> converted = new ArrayList<>(elements.length);
            for (Object element : Arrays.asList(elements)) {
                converted.add(toJsonValue(element));
            }
            return converted;
        }
        return value.toString();
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Reader already closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed (connection may be closed): {}", e.getMessage());
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to return connection to pool: {}", e.getMessage());
        }
    }
}
