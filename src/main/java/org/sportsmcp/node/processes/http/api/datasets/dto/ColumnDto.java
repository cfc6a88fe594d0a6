package org.sportsmcp.node.processes.http.api.datasets.dto;

import org.sportsmcp.dataservice.api.registry.ColumnDescriptor;

/**
 * Column metadata as published to clients.
 */
public record ColumnDto(String name, String dtype, String description, String units) {

    public static ColumnDto from(ColumnDescriptor column) {
        return new ColumnDto(column.name(), column.dtype(), column.description(), column.units());
    }
}
