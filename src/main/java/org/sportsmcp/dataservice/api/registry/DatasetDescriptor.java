package org.sportsmcp.dataservice.api.registry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable metadata record for one dataset: the backing table, its columns and the key
 * used to order pages.
 * <p>
 * Instances are created once by the registry loader and shared read-only between all
 * request threads.
 * <p>
 * <strong>Invariants:</strong>
 * <ul>
 *   <li>at least one column</li>
 *   <li>column names are unique</li>
 *   <li>every primary key column is one of the columns</li>
 * </ul>
 * An empty primary key is allowed. Row order across pages is then whatever the store
 * returns and is not guaranteed to be stable between calls.
 */
public final class DatasetDescriptor {

    private final String datasetId;
    private final String schema;
    private final String table;
    private final String name;
    private final String description;
    private final List<String> primaryKey;
    private final List<ColumnDescriptor> columns;
    private final Set<String> columnNames;
    private final Long sampleSize;

    private DatasetDescriptor(Builder builder) {
        this.datasetId = requireText(builder.datasetId, "datasetId");
        this.schema = requireText(builder.schema, "schema");
        this.table = requireText(builder.table, "table");
        this.name = builder.name != null ? builder.name : datasetId;
        this.description = builder.description != null ? builder.description : "";
        this.columns = List.copyOf(builder.columns);
        this.primaryKey = List.copyOf(builder.primaryKey);
        this.sampleSize = builder.sampleSize;

        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Dataset '" + datasetId + "' declares no columns");
        }

        Set<String> names = new LinkedHashSet<>();
        for (ColumnDescriptor column : columns) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException(
                    "Dataset '" + datasetId + "' declares column '" + column.name() + "' more than once");
            }
        }
        this.columnNames = Collections.unmodifiableSet(names);

        for (String keyColumn : primaryKey) {
            if (!columnNames.contains(keyColumn)) {
                throw new IllegalArgumentException(
                    "Dataset '" + datasetId + "' has primary key column '" + keyColumn + "' which is not a declared column");
            }
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDatasetId() {
        return datasetId;
    }

    public String getSchema() {
        return schema;
    }

    public String getTable() {
        return table;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return primary key columns in declared order, possibly empty
     */
    public List<String> getPrimaryKey() {
        return primaryKey;
    }

    /**
     * @return columns in declared order, never empty
     */
    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    /**
     * @return the set of column names, iteration order matches {@link #getColumns()}
     */
    public Set<String> getColumnNames() {
        return columnNames;
    }

    public boolean hasColumn(String columnName) {
        return columnNames.contains(columnName);
    }

    /**
     * @return informational row count hint, or {@code null} if unknown
     */
    public Long getSampleSize() {
        return sampleSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatasetDescriptor that)) return false;
        return datasetId.equals(that.datasetId)
            && schema.equals(that.schema)
            && table.equals(that.table)
            && name.equals(that.name)
            && description.equals(that.description)
            && primaryKey.equals(that.primaryKey)
            && columns.equals(that.columns)
            && Objects.equals(sampleSize, that.sampleSize);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasetId, schema, table, columns);
    }

    @Override
    public String toString() {
        return "DatasetDescriptor{" + datasetId + " -> " + schema + "." + table + ", " + columns.size() + " columns}";
    }

    public static final class Builder {
        private String datasetId;
        private String schema;
        private String table;
        private String name;
        private String description;
        private List<String> primaryKey = List.of();
        private List<ColumnDescriptor> columns = List.of();
        private Long sampleSize;

        private Builder() {
        }

        public Builder datasetId(String datasetId) {
            this.datasetId = datasetId;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder primaryKey(List<String> primaryKey) {
            this.primaryKey = Objects.requireNonNull(primaryKey, "primaryKey");
            return this;
        }

        public Builder columns(List<ColumnDescriptor> columns) {
            this.columns = Objects.requireNonNull(columns, "columns");
            return this;
        }

        public Builder sampleSize(Long sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any invariant is violated
         */
        public DatasetDescriptor build() {
            return new DatasetDescriptor(this);
        }
    }
}
