package org.sportsmcp.dataservice.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.sportsmcp.dataservice.api.query.InvalidColumnException;
import org.sportsmcp.dataservice.api.query.QueryFilter;
import org.sportsmcp.dataservice.api.registry.ColumnDescriptor;
import org.sportsmcp.dataservice.api.registry.DatasetDescriptor;

/**
 * Resolves the projection of a query and checks every referenced column against the
 * dataset descriptor.
 * <p>
 * Stateless and thread-safe.
 */
public class QueryValidator {

    /**
     * Validates a projection and a filter list against a dataset.
     * <p>
     * An absent or empty projection resolves to all columns in descriptor order. Filter
     * columns are checked independently of the projection, so a query may filter on a column
     * it does not return.
     *
     * @param descriptor       the dataset
     * @param requestedColumns requested projection, may be {@code null}
     * @param filters          filters to check, may be empty
     * @return the resolved query
     * @throws InvalidColumnException listing every unknown column from projection and filters
     */
    public ValidatedQuery validate(DatasetDescriptor descriptor,
                                   List<String> requestedColumns,
                                   List<QueryFilter> filters) throws InvalidColumnException {
        Set<String> unknown = new LinkedHashSet<>();

        List<String> resolvedColumns;
        if (requestedColumns == null || requestedColumns.isEmpty()) {
            resolvedColumns = new ArrayList<>(descriptor.getColumns().size());
            for (ColumnDescriptor column : descriptor.getColumns()) {
                resolvedColumns.add(column.name());
            }
        } else {
            for (String column : requestedColumns) {
                if (!descriptor.hasColumn(column)) {
                    unknown.add(column);
                }
            }
            resolvedColumns = requestedColumns;
        }

        for (QueryFilter filter : filters) {
            if (!descriptor.hasColumn(filter.column())) {
                unknown.add(filter.column());
            }
        }

        if (!unknown.isEmpty()) {
            throw new InvalidColumnException(descriptor.getDatasetId(), new ArrayList<>(unknown));
        }
        return new ValidatedQuery(descriptor, resolvedColumns, filters);
    }
}
