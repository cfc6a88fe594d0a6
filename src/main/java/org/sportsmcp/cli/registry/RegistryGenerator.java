package org.sportsmcp.cli.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Generates dataset descriptor stubs from database metadata.
 * <p>
 * For every base table of the requested schemas one file
 * {@code <outputDir>/<schema>/<table>.json} is written with:
 * <ul>
 *   <li>{@code dataset_id} = {@code schema.table}</li>
 *   <li>a title-cased {@code name} and the table comment as {@code description}</li>
 *   <li>columns in ordinal order with {@code dtype}, {@code nullable} and the column comment</li>
 *   <li>{@code primary_key} from the table's declared key</li>
 *   <li>{@code sample_size} = {@code null}</li>
 * </ul>
 * Keys are sorted and output is pretty-printed so regenerated files diff cleanly. The stubs are
 * meant to be curated by hand afterwards (units, better descriptions).
 */
public class RegistryGenerator {

    private static final Logger log = LoggerFactory.getLogger(RegistryGenerator.class);

    /** PostgreSQL reports {@code TABLE}, H2 2.x {@code BASE TABLE}. */
    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    private final ObjectMapper objectMapper;

    public RegistryGenerator() {
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Introspects the schemas and writes one descriptor per table.
     *
     * @param connection open connection to the source database
     * @param schemas    schema names, matched exactly
     * @param outputDir  registry root to write into
     * @return written files in generation order
     * @throws SQLException if metadata cannot be read
     * @throws IOException  if a file cannot be written
     */
    public List<Path> generate(Connection connection, List<String> schemas, Path outputDir)
            throws SQLException, IOException {
        DatabaseMetaData metaData = connection.getMetaData();
        List<Path> written = new ArrayList<>();
        for (String schema : schemas) {
            List<TableInfo> tables = listTables(metaData, schema);
            if (tables.isEmpty()) {
                log.warn("Schema '{}' has no base tables", schema);
            }
            for (TableInfo table : tables) {
                Map<String, Object> descriptor = describeTable(metaData, schema, table);
                Path file = outputDir.resolve(schema).resolve(table.name() + ".json");
                Files.createDirectories(file.getParent());
                objectMapper.writeValue(file.toFile(), descriptor);
                log.debug("Wrote descriptor for {}.{} to {}", schema, table.name(), file);
                written.add(file);
            }
        }
        log.info("Generated {} descriptor(s) for schema(s) {} under {}", written.size(), schemas, outputDir.toAbsolutePath());
        return written;
    }

    private List<TableInfo> listTables(DatabaseMetaData metaData, String schema) throws SQLException {
        // schema is a LIKE pattern for the driver; '_' would match any character
        Map<String, TableInfo> tables = new TreeMap<>();
        try (ResultSet rs = metaData.getTables(null, schema, "%", TABLE_TYPES)) {
            while (rs.next()) {
                if (!schema.equals(rs.getString("TABLE_SCHEM"))) {
                    continue;
                }
                String name = rs.getString("TABLE_NAME");
                tables.put(name, new TableInfo(name, rs.getString("REMARKS")));
            }
        }
        return new ArrayList<>(tables.values());
    }

    private Map<String, Object> describeTable(DatabaseMetaData metaData, String schema, TableInfo table)
            throws SQLException {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("dataset_id", schema + "." + table.name());
        descriptor.put("schema", schema);
        descriptor.put("table", table.name());
        descriptor.put("name", friendlyName(table.name()));
        descriptor.put("description", table.remarks() != null ? table.remarks() : "");
        descriptor.put("primary_key", primaryKey(metaData, schema, table.name()));
        descriptor.put("columns", columns(metaData, schema, table.name()));
        descriptor.put("sample_size", null);
        return descriptor;
    }

    private List<Map<String, Object>> columns(DatabaseMetaData metaData, String schema, String table)
            throws SQLException {
        Map<Integer, Map<String, Object>> byPosition = new TreeMap<>();
        try (ResultSet rs = metaData.getColumns(null, schema, table, "%")) {
            while (rs.next()) {
                if (!schema.equals(rs.getString("TABLE_SCHEM")) || !table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                Map<String, Object> column = new LinkedHashMap<>();
                column.put("name", rs.getString("COLUMN_NAME"));
                column.put("dtype", rs.getString("TYPE_NAME").toLowerCase(Locale.ROOT));
                String remarks = rs.getString("REMARKS");
                column.put("description", remarks != null ? remarks : "");
                column.put("units", null);
                column.put("nullable", rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls);
                byPosition.put(rs.getInt("ORDINAL_POSITION"), column);
            }
        }
        return new ArrayList<>(byPosition.values());
    }

    private List<String> primaryKey(DatabaseMetaData metaData, String schema, String table) throws SQLException {
        Map<Short, String> bySequence = new TreeMap<>();
        try (ResultSet rs = metaData.getPrimaryKeys(null, schema, table)) {
            while (rs.next()) {
                if (schema.equals(rs.getString("TABLE_SCHEM")) && table.equals(rs.getString("TABLE_NAME"))) {
                    bySequence.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
                }
            }
        }
        return new ArrayList<>(bySequence.values());
    }

    /**
     * {@code pitching_outings} becomes {@code Pitching Outings}.
     */
    static String friendlyName(String tableName) {
        return Arrays.stream(tableName.split("_"))
            .filter(part -> !part.isEmpty())
            .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
            .collect(Collectors.joining(" "));
    }

    private record TableInfo(String name, String remarks) {
    }
}
