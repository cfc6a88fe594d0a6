package org.sportsmcp.dataservice.query;

import java.util.List;

import org.sportsmcp.dataservice.api.query.QueryFilter;
import org.sportsmcp.dataservice.api.registry.DatasetDescriptor;

/**
 * Output of {@link QueryValidator}: the resolved projection and the filters, both checked
 * against the dataset's columns.
 *
 * @param descriptor the dataset
 * @param columns    resolved projection, never empty
 * @param filters    validated filters in request order
 */
public record ValidatedQuery(DatasetDescriptor descriptor, List<String> columns, List<QueryFilter> filters) {

    public ValidatedQuery {
        columns = List.copyOf(columns);
        filters = List.copyOf(filters);
    }
}
