package org.sportsmcp.dataservice.api.query;

import java.util.Objects;

/**
 * One filter condition: {@code <column> <op> <value>}.
 * <p>
 * The value is a JSON scalar ({@link String}, {@link Number}, {@link Boolean}) or
 * {@code null}. A {@code null} value never matches a row.
 *
 * @param column column name
 * @param op     comparison operator
 * @param value  comparison value, bound as a statement parameter
 */
public record QueryFilter(String column, FilterOp op, Object value) {

    public QueryFilter {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(op, "op");
    }

    public static QueryFilter eq(String column, Object value) {
        return new QueryFilter(column, FilterOp.EQ, value);
    }

    public static QueryFilter gte(String column, Object value) {
        return new QueryFilter(column, FilterOp.GTE, value);
    }

    public static QueryFilter lte(String column, Object value) {
        return new QueryFilter(column, FilterOp.LTE, value);
    }
}
