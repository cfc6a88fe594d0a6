package org.sportsmcp.dataservice.api.query;

import java.util.List;

/**
 * Thrown when a projection or filter references columns the dataset does not have.
 * <p>
 * Carries every offending name found in the request, not just the first one.
 */
public class InvalidColumnException extends Exception {

    private final String datasetId;
    private final List<String> columns;

    /**
     * @param datasetId the dataset that was queried
     * @param columns   unknown column names in first-occurrence order, never empty
     */
    public InvalidColumnException(String datasetId, List<String> columns) {
        super("Unknown column(s) for dataset '" + datasetId + "': " + String.join(", ", columns));
        this.datasetId = datasetId;
        this.columns = List.copyOf(columns);
    }

    public String getDatasetId() {
        return datasetId;
    }

    /**
     * @return the unknown column names
     */
    public List<String> getColumns() {
        return columns;
    }
}
