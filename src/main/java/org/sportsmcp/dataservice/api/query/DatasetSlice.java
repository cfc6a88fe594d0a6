package org.sportsmcp.dataservice.api.query;

import java.util.List;
import java.util.Map;

/**
 * One page of a dataset query.
 *
 * @param datasetId  the queried dataset
 * @param total      rows matching the filters, ignoring limit and offset
 * @param returned   rows in {@code data}
 * @param offset     the requested offset
 * @param nextOffset offset of the following page, or {@code null} if this is the last one
 * @param data       rows as ordered column-to-value maps, in projection order
 */
public record DatasetSlice(String datasetId,
                           long total,
                           int returned,
                           long offset,
                           Long nextOffset,
                           List<Map<String, Object>> data) {

    public DatasetSlice {
        data = List.copyOf(data);
    }

    public boolean hasNextPage() {
        return nextOffset != null;
    }
}
