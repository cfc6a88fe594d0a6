package org.sportsmcp.node.processes.http.api.datasets.dto;

import java.util.List;

import org.sportsmcp.dataservice.api.registry.DatasetDescriptor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public metadata of one dataset. Schema and table names stay server-side.
 */
public record DatasetMetaDto(
    @JsonProperty("dataset_id") String datasetId,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("primary_key") List<String> primaryKey,
    @JsonProperty("columns") List<ColumnDto> columns,
    @JsonProperty("sample_size") Long sampleSize
) {

    public static DatasetMetaDto from(DatasetDescriptor descriptor) {
        return new DatasetMetaDto(
            descriptor.getDatasetId(),
            descriptor.getName(),
            descriptor.getDescription(),
            descriptor.getPrimaryKey(),
            descriptor.getColumns().stream().map(ColumnDto::from).toList(),
            descriptor.getSampleSize());
    }
}
