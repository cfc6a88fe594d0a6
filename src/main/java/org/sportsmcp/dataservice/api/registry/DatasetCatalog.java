package org.sportsmcp.dataservice.api.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog mapping dataset identifiers to their descriptors.
 * <p>
 * Built once at startup and handed to the components that need it. Iteration order is the
 * order in which descriptors were added.
 * <p>
 * <strong>Thread Safety:</strong> immutable after construction, safe to share without
 * synchronization.
 */
public final class DatasetCatalog {

    private final Map<String, DatasetDescriptor> datasets;

    private DatasetCatalog(Map<String, DatasetDescriptor> datasets) {
        this.datasets = Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
    }

    /**
     * Creates a catalog from the given descriptors.
     *
     * @param descriptors descriptors in catalog order
     * @return the catalog
     * @throws IllegalArgumentException if two descriptors share a dataset id
     */
    public static DatasetCatalog of(List<DatasetDescriptor> descriptors) {
        Map<String, DatasetDescriptor> byId = new LinkedHashMap<>();
        for (DatasetDescriptor descriptor : descriptors) {
            if (byId.putIfAbsent(descriptor.getDatasetId(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate dataset id: " + descriptor.getDatasetId());
            }
        }
        return new DatasetCatalog(byId);
    }

    public Optional<DatasetDescriptor> find(String datasetId) {
        if (datasetId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(datasets.get(datasetId));
    }

    public Collection<DatasetDescriptor> all() {
        return datasets.values();
    }

    public int size() {
        return datasets.size();
    }

    public boolean isEmpty() {
        return datasets.isEmpty();
    }
}
