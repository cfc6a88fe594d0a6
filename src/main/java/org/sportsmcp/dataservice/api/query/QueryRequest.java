package org.sportsmcp.dataservice.api.query;

import java.util.List;

/**
 * Declarative query against one dataset.
 *
 * @param filters filters combined with AND, in order; never {@code null}
 * @param columns requested projection, or {@code null}/empty for all columns in descriptor order
 * @param limit   page size, {@value #MIN_LIMIT}..{@value #MAX_LIMIT}
 * @param offset  number of matching rows to skip, non-negative
 */
public record QueryRequest(List<QueryFilter> filters, List<String> columns, int limit, long offset) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 500;

    public QueryRequest {
        filters = filters == null ? List.of() : List.copyOf(filters);
        columns = columns == null ? null : List.copyOf(columns);
    }

    /**
     * @return a request with no filters, all columns, default limit and offset 0
     */
    public static QueryRequest defaults() {
        return new QueryRequest(List.of(), null, DEFAULT_LIMIT, 0);
    }

    public QueryRequest withFilters(List<QueryFilter> newFilters) {
        return new QueryRequest(newFilters, columns, limit, offset);
    }

    public QueryRequest withColumns(List<String> newColumns) {
        return new QueryRequest(filters, newColumns, limit, offset);
    }

    public QueryRequest withLimit(int newLimit) {
        return new QueryRequest(filters, columns, newLimit, offset);
    }

    public QueryRequest withOffset(long newOffset) {
        return new QueryRequest(filters, columns, limit, newOffset);
    }

    /**
     * Checks the numeric bounds of {@code limit} and {@code offset}.
     *
     * @throws MalformedQueryException if a bound is violated
     */
    public void checkBounds() {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new MalformedQueryException(
                "limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT + ", got " + limit);
        }
        if (offset < 0) {
            throw new MalformedQueryException("offset must be non-negative, got " + offset);
        }
    }
}
