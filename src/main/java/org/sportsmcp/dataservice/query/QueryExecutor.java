package org.sportsmcp.dataservice.query;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import org.sportsmcp.dataservice.api.query.DatasetSlice;
import org.sportsmcp.dataservice.api.query.StoreUnavailableException;
import org.sportsmcp.dataservice.api.resources.database.IDatasetReader;
import org.sportsmcp.dataservice.api.resources.database.IDatasetReaderProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link TranslatedQuery} against the store and assembles the result page.
 * <p>
 * Count and fetch run on the same pooled connection and transaction. The connection is
 * returned to the pool on every exit path. A failure in either statement fails the whole
 * request; there is no partial page and no retry.
 * <p>
 * <strong>Thread Safety:</strong> stateless apart from the shared reader provider; any
 * number of requests may execute concurrently.
 */
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final IDatasetReaderProvider readerProvider;

    public QueryExecutor(IDatasetReaderProvider readerProvider) {
        this.readerProvider = readerProvider;
    }

    /**
     * Executes the count and fetch statements and builds the page.
     *
     * @param query  compiled statements
     * @param limit  page size the fetch statement was compiled with
     * @param offset offset the fetch statement was compiled with
     * @return the page
     * @throws StoreUnavailableException if no connection could be obtained or a statement failed
     */
    public DatasetSlice execute(TranslatedQuery query, int limit, long offset) throws StoreUnavailableException {
        final long startNs = System.nanoTime();

        final long total;
        final List<Map<String, Object>> rows;
        try (IDatasetReader reader = readerProvider.createReader()) {
            total = reader.count(query.countStatement());
            rows = reader.fetch(query.fetchStatement(), query.columns());
        } catch (SQLException e) {
            throw new StoreUnavailableException(
                "Query against dataset '" + query.datasetId() + "' failed: " + e.getMessage(), e);
        }

        final Long nextOffset = nextOffset(offset, limit, total);

        if (log.isDebugEnabled()) {
            log.debug("Queried dataset '{}': total={}, returned={}, offset={}, nextOffset={} in {}ms",
                query.datasetId(), total, rows.size(), offset, nextOffset,
                (System.nanoTime() - startNs) / 1_000_000);
        }

        return new DatasetSlice(query.datasetId(), total, rows.size(), offset, nextOffset, rows);
    }

    /**
     * Computes the offset of the following page from the total alone, independent of how many
     * rows the fetch actually returned.
     *
     * Compared as {@code offset < total - limit}; {@code offset + limit} may exceed
     * {@code Long.MAX_VALUE} for very large offsets.
     *
     * @return {@code offset + limit} if rows remain beyond this page, otherwise {@code null}
     */
    static Long nextOffset(long offset, int limit, long total) {
        return offset < total - limit ? offset + limit : null;
    }
}
