package org.sportsmcp.dataservice.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.sportsmcp.dataservice.api.registry.ColumnDescriptor;
import org.sportsmcp.dataservice.api.registry.DatasetCatalog;
import org.sportsmcp.dataservice.api.registry.DatasetDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads dataset descriptor files from a directory tree into a {@link DatasetCatalog}.
 * <p>
 * Every {@code *.json} file below the root is one dataset. Files are read in sorted path
 * order so the catalog order is reproducible across file systems. Layout produced by the
 * {@code generate-registry} command:
 * <pre>
 *   registry/
 *     marts_baseball/
 *       pitching_outings.json
 *     staging_baseball/
 *       games.json
 * </pre>
 * Descriptor format:
 * <pre>
 * {
 *   "dataset_id": "pitching_outings",
 *   "schema": "marts_baseball",
 *   "table": "pitching_outings",
 *   "name": "Pitching Outings",
 *   "description": "One row per pitcher appearance",
 *   "primary_key": ["player_id", "game_date"],
 *   "columns": [
 *     {"name": "player_id", "dtype": "string", "description": "Canonical pitcher identifier"},
 *     {"name": "outs_recorded", "dtype": "int", "units": "outs", "nullable": false}
 *   ],
 *   "sample_size": 4
 * }
 * </pre>
 * Column entries are parsed permissively: unknown fields are ignored and optional fields
 * default to absent. Any structural problem aborts the whole load.
 */
public class RegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(RegistryLoader.class);

    private static final String DESCRIPTOR_SUFFIX = ".json";

    private final ObjectMapper objectMapper;

    public RegistryLoader() {
        this(new ObjectMapper());
    }

    public RegistryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads every descriptor below {@code root}.
     *
     * @param root registry root directory
     * @return the catalog, never empty
     * @throws RegistryLoadException on any fatal load condition
     */
    public DatasetCatalog load(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new RegistryLoadException("Dataset registry directory not found: "
                + (root == null ? "(not configured)" : root.toAbsolutePath()));
        }

        List<Path> files = findDescriptorFiles(root);
        log.debug("Found {} descriptor file(s) under {}", files.size(), root.toAbsolutePath());

        List<DatasetDescriptor> descriptors = new ArrayList<>(files.size());
        Map<String, Path> sourceById = new HashMap<>();
        for (Path file : files) {
            DatasetDescriptor descriptor = parseFile(file);
            Path previous = sourceById.putIfAbsent(descriptor.getDatasetId(), file);
            if (previous != null) {
                throw new RegistryLoadException(String.format(
                    "Duplicate dataset_id '%s' declared in %s and %s",
                    descriptor.getDatasetId(), previous, file));
            }
            descriptors.add(descriptor);
            log.debug("Loaded dataset '{}' ({}.{}, {} columns) from {}",
                descriptor.getDatasetId(), descriptor.getSchema(), descriptor.getTable(),
                descriptor.getColumns().size(), file);
        }

        if (descriptors.isEmpty()) {
            throw new RegistryLoadException("Dataset registry is empty: no descriptor files under "
                + root.toAbsolutePath());
        }

        log.info("Loaded {} dataset(s) from registry {}", descriptors.size(), root.toAbsolutePath());
        return DatasetCatalog.of(descriptors);
    }

    private List<Path> findDescriptorFiles(Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(DESCRIPTOR_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to scan dataset registry " + root.toAbsolutePath(), e);
        }
    }

    /**
     * Parses one descriptor file.
     *
     * @param file descriptor file
     * @return the parsed descriptor
     * @throws RegistryLoadException if the file is unreadable or invalid
     */
    DatasetDescriptor parseFile(Path file) {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new RegistryLoadException("Invalid JSON in descriptor " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to read descriptor " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new RegistryLoadException("Descriptor " + file + " must contain a JSON object");
        }

        String datasetId = requiredText(root, "dataset_id", file);
        String schema = requiredText(root, "schema", file);
        String table = requiredText(root, "table", file);

        JsonNode columnsNode = root.path("columns");
        if (!columnsNode.isArray() || columnsNode.isEmpty()) {
            throw new RegistryLoadException("Dataset '" + datasetId + "' in " + file + " declares no columns");
        }
        List<ColumnDescriptor> columns = new ArrayList<>(columnsNode.size());
        for (JsonNode columnNode : columnsNode) {
            columns.add(parseColumn(columnNode, datasetId, file));
        }

        List<String> primaryKey = new ArrayList<>();
        JsonNode keyNode = root.path("primary_key");
        if (keyNode.isArray()) {
            for (JsonNode keyColumn : keyNode) {
                if (!keyColumn.isTextual()) {
                    throw new RegistryLoadException(
                        "Dataset '" + datasetId + "' in " + file + " has a non-string primary_key entry");
                }
                primaryKey.add(keyColumn.asText());
            }
        } else if (!keyNode.isMissingNode() && !keyNode.isNull()) {
            throw new RegistryLoadException("Dataset '" + datasetId + "' in " + file + ": primary_key must be an array");
        }

        JsonNode sampleNode = root.path("sample_size");
        Long sampleSize = sampleNode.isIntegralNumber() ? sampleNode.asLong() : null;

        try {
            return DatasetDescriptor.builder()
                .datasetId(datasetId)
                .schema(schema)
                .table(table)
                .name(optionalText(root, "name"))
                .description(optionalText(root, "description"))
                .primaryKey(primaryKey)
                .columns(columns)
                .sampleSize(sampleSize)
                .build();
        } catch (IllegalArgumentException e) {
            throw new RegistryLoadException("Invalid descriptor " + file + ": " + e.getMessage(), e);
        }
    }

    private ColumnDescriptor parseColumn(JsonNode node, String datasetId, Path file) {
        if (!node.isObject()) {
            throw new RegistryLoadException("Dataset '" + datasetId + "' in " + file + " has a column entry that is not an object");
        }
        String name = optionalText(node, "name");
        if (name == null || name.isBlank()) {
            throw new RegistryLoadException("Dataset '" + datasetId + "' in " + file + " has a column without a name");
        }
        JsonNode nullableNode = node.path("nullable");
        Boolean nullable = nullableNode.isBoolean() ? nullableNode.booleanValue() : null;
        return new ColumnDescriptor(
            name,
            optionalText(node, "dtype"),
            optionalText(node, "description"),
            optionalText(node, "units"),
            nullable);
    }

    private static String requiredText(JsonNode node, String field, Path file) {
        String value = optionalText(node, field);
        if (value == null || value.isBlank()) {
            throw new RegistryLoadException("Descriptor " + file + " is missing required field '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
