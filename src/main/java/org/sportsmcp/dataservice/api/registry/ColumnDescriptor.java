package org.sportsmcp.dataservice.api.registry;

import java.util.Objects;

/**
 * Describes one column of a dataset's backing table.
 * <p>
 * Only {@code name} participates in query semantics. The remaining fields are display
 * metadata carried through from the descriptor file and may be {@code null}.
 *
 * @param name        column name as it exists in the backing table
 * @param dtype       free-form type label (e.g. {@code "int4"}, {@code "date"})
 * @param description human readable description
 * @param units       unit of measurement
 * @param nullable    whether the backing column accepts nulls, if known
 */
public record ColumnDescriptor(String name, String dtype, String description, String units, Boolean nullable) {

    public ColumnDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
    }

    public static ColumnDescriptor of(String name, String dtype) {
        return new ColumnDescriptor(name, dtype, null, null, null);
    }
}
