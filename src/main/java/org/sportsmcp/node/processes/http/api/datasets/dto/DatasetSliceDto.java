package org.sportsmcp.node.processes.http.api.datasets.dto;

import java.util.List;
import java.util.Map;

import org.sportsmcp.dataservice.api.query.DatasetSlice;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result envelope of a query. {@code next_offset} is always written, as {@code null} on the
 * last page.
 */
public record DatasetSliceDto(
    @JsonProperty("dataset_id") String datasetId,
    @JsonProperty("total") long total,
    @JsonProperty("returned") int returned,
    @JsonProperty("offset") long offset,
    @JsonProperty("next_offset") @JsonInclude(JsonInclude.Include.ALWAYS) Long nextOffset,
    @JsonProperty("data") List<Map<String, Object>> data
) {

    public static DatasetSliceDto from(DatasetSlice slice) {
        return new DatasetSliceDto(
            slice.datasetId(), slice.total(), slice.returned(), slice.offset(), slice.nextOffset(), slice.data());
    }
}
