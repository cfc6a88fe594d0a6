package org.sportsmcp.dataservice.api.query;

/**
 * Thrown when a dataset identifier is not present in the catalog.
 */
public class DatasetNotFoundException extends Exception {

    private final String datasetId;

    /**
     * @param datasetId the identifier that could not be resolved
     */
    public DatasetNotFoundException(String datasetId) {
        super("Dataset not found: " + datasetId);
        this.datasetId = datasetId;
    }

    public String getDatasetId() {
        return datasetId;
    }
}
