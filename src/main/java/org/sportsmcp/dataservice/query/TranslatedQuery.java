package org.sportsmcp.dataservice.query;

import java.util.List;

import org.sportsmcp.dataservice.api.query.SqlStatement;

/**
 * The two statements compiled for one query. Both share the same predicate and filter
 * parameters; the fetch statement additionally binds limit and offset.
 *
 * @param datasetId      the dataset
 * @param countStatement {@code SELECT COUNT(*)} over the filtered table
 * @param fetchStatement projection, ordering and pagination over the filtered table
 * @param columns        projected column names in select-list order
 */
public record TranslatedQuery(String datasetId,
                              SqlStatement countStatement,
                              SqlStatement fetchStatement,
                              List<String> columns) {

    public TranslatedQuery {
        columns = List.copyOf(columns);
    }
}
