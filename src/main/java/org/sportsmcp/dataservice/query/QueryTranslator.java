package org.sportsmcp.dataservice.query;

import java.util.List;

import org.sportsmcp.dataservice.api.query.FilterOp;
import org.sportsmcp.dataservice.api.query.QueryFilter;
import org.sportsmcp.dataservice.api.query.SqlStatement;
import org.sportsmcp.dataservice.api.registry.DatasetDescriptor;

/**
 * Compiles a {@link ValidatedQuery} into a count statement and a fetch statement.
 * <p>
 * <strong>Generated SQL Structure:</strong>
 * <pre>
 * SELECT COUNT(*) FROM "schema"."table" [WHERE "c1" = ? AND "c2" &gt;= ?]
 *
 * SELECT "p1", "p2", ...
 * FROM "schema"."table"
 * [WHERE "c1" = ? AND "c2" &gt;= ?]
 * [ORDER BY "pk1", "pk2", ...]
 * LIMIT ? OFFSET ?
 * </pre>
 * <p>
 * Every identifier is quoted and every value, including limit and offset, is a bound
 * parameter. Filters appear in request order so the statement text is reproducible. The
 * {@code ORDER BY} clause is omitted when the dataset has no primary key; row order across
 * pages is then store-defined.
 * <p>
 * Stateless and thread-safe.
 */
public class QueryTranslator {

    /**
     * Builds the count and fetch statements for a query.
     *
     * @param query  validated query
     * @param limit  page size
     * @param offset rows to skip
     * @return both statements
     */
    public TranslatedQuery translate(ValidatedQuery query, int limit, long offset) {
        DatasetDescriptor descriptor = query.descriptor();

        SqlStatement.Builder count = SqlStatement.builder()
            .keyword("SELECT COUNT(*) FROM")
            .qualifiedName(descriptor.getSchema(), descriptor.getTable());
        appendPredicate(count, query.filters());

        SqlStatement.Builder fetch = SqlStatement.builder()
            .keyword("SELECT")
            .identifierList(query.columns())
            .keyword("FROM")
            .qualifiedName(descriptor.getSchema(), descriptor.getTable());
        appendPredicate(fetch, query.filters());
        appendOrdering(fetch, descriptor.getPrimaryKey());
        fetch.keyword("LIMIT").parameter(limit)
            .keyword("OFFSET").parameter(offset);

        return new TranslatedQuery(descriptor.getDatasetId(), count.build(), fetch.build(), query.columns());
    }

    private static void appendPredicate(SqlStatement.Builder builder, List<QueryFilter> filters) {
        if (filters.isEmpty()) {
            return;
        }
        builder.keyword("WHERE");
        for (int i = 0; i < filters.size(); i++) {
            QueryFilter filter = filters.get(i);
            if (i > 0) {
                builder.keyword("AND");
            }
            builder.identifier(filter.column())
                .keyword(comparisonSymbol(filter.op()))
                .parameter(filter.value());
        }
    }

    private static void appendOrdering(SqlStatement.Builder builder, List<String> primaryKey) {
        if (primaryKey.isEmpty()) {
            return;
        }
        builder.keyword("ORDER BY").identifierList(primaryKey);
    }

    static String comparisonSymbol(FilterOp op) {
        return switch (op) {
            case EQ -> "=";
            case GTE -> ">=";
            case LTE -> "<=";
        };
    }
}
