package org.sportsmcp.dataservice.query;

import java.util.Collection;

import org.sportsmcp.dataservice.api.query.DatasetNotFoundException;
import org.sportsmcp.dataservice.api.query.DatasetSlice;
import org.sportsmcp.dataservice.api.query.InvalidColumnException;
import org.sportsmcp.dataservice.api.query.QueryRequest;
import org.sportsmcp.dataservice.api.query.StoreUnavailableException;
import org.sportsmcp.dataservice.api.registry.DatasetCatalog;
import org.sportsmcp.dataservice.api.registry.DatasetDescriptor;
import org.sportsmcp.dataservice.api.resources.database.IDatasetReaderProvider;

/**
 * Entry point for the three dataset operations: list, describe and query.
 * <p>
 * A query flows through {@link QueryValidator}, {@link QueryTranslator} and
 * {@link QueryExecutor}. Lookups against the catalog happen first, so an unknown dataset
 * is reported before anything else about the request.
 * <p>
 * <strong>Thread Safety:</strong> thread-safe; the catalog is immutable and the collaborators
 * are stateless.
 */
public class DatasetQueryService {

    private final DatasetCatalog catalog;
    private final QueryValidator validator;
    private final QueryTranslator translator;
    private final QueryExecutor executor;

    public DatasetQueryService(DatasetCatalog catalog, IDatasetReaderProvider readerProvider) {
        this(catalog, new QueryValidator(), new QueryTranslator(), new QueryExecutor(readerProvider));
    }

    public DatasetQueryService(DatasetCatalog catalog,
                               QueryValidator validator,
                               QueryTranslator translator,
                               QueryExecutor executor) {
        this.catalog = catalog;
        this.validator = validator;
        this.translator = translator;
        this.executor = executor;
    }

    /**
     * @return every dataset in catalog order
     */
    public Collection<DatasetDescriptor> listDatasets() {
        return catalog.all();
    }

    /**
     * @param datasetId dataset identifier
     * @return the dataset's descriptor
     * @throws DatasetNotFoundException if the dataset is not in the catalog
     */
    public DatasetDescriptor describe(String datasetId) throws DatasetNotFoundException {
        return catalog.find(datasetId).orElseThrow(() -> new DatasetNotFoundException(datasetId));
    }

    /**
     * Queries one page of a dataset.
     *
     * @param datasetId dataset identifier
     * @param request   filters, projection and pagination
     * @return the page
     * @throws DatasetNotFoundException  if the dataset is not in the catalog
     * @throws InvalidColumnException    if the projection or a filter names an unknown column
     * @throws StoreUnavailableException if the store could not run the statements
     * @throws org.sportsmcp.dataservice.api.query.MalformedQueryException if limit or offset is out of bounds
     */
    public DatasetSlice query(String datasetId, QueryRequest request)
            throws DatasetNotFoundException, InvalidColumnException, StoreUnavailableException {
        DatasetDescriptor descriptor = describe(datasetId);
        request.checkBounds();

        ValidatedQuery validated = validator.validate(descriptor, request.columns(), request.filters());
        TranslatedQuery translated = translator.translate(validated, request.limit(), request.offset());
        return executor.execute(translated, request.limit(), request.offset());
    }
}
