package org.sportsmcp.node.processes.http.api.datasets;

import java.util.List;

import org.sportsmcp.dataservice.api.query.DatasetNotFoundException;
import org.sportsmcp.dataservice.api.query.DatasetSlice;
import org.sportsmcp.dataservice.api.query.InvalidColumnException;
import org.sportsmcp.dataservice.api.query.QueryRequest;
import org.sportsmcp.dataservice.api.query.StoreUnavailableException;
import org.sportsmcp.dataservice.query.DatasetQueryService;
import org.sportsmcp.node.processes.http.api.AbstractController;
import org.sportsmcp.node.processes.http.api.ErrorResponseDto;
import org.sportsmcp.node.processes.http.api.datasets.dto.DatasetMetaDto;
import org.sportsmcp.node.processes.http.api.datasets.dto.DatasetSliceDto;
import org.sportsmcp.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;

/**
 * HTTP controller exposing the dataset catalog and the query operation.
 * <p>
 * Routes, relative to the configured base path:
 * <ul>
 *   <li>{@code GET /} - metadata of every dataset</li>
 *   <li>{@code GET /{datasetId}} - metadata of one dataset</li>
 *   <li>{@code POST /{datasetId}/query} - one page of filtered, projected rows</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> stateless; the query service and decoder are thread-safe.
 */
public class DatasetController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetController.class);

    private final DatasetQueryService queryService;
    private final DatasetQueryDecoder decoder;

    /**
     * @param registry The central service registry; must hold a {@link DatasetQueryService}.
     * @param options  The HOCON configuration specific to this controller instance.
     */
    public DatasetController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.queryService = registry.get(DatasetQueryService.class);
        this.decoder = new DatasetQueryDecoder();
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String listPath = path(basePath, "/");
        final String datasetPath = path(basePath, "/{datasetId}");
        final String queryPath = path(basePath, "/{datasetId}/query");

        LOGGER.debug("Registering dataset endpoints: list={}, describe={}, query={}", listPath, datasetPath, queryPath);

        app.get(listPath, this::listDatasets);
        app.get(datasetPath, this::describeDataset);
        app.post(queryPath, this::queryDataset);

        setupExceptionHandlers(app);
    }

    @OpenApi(
        path = "/datasets",
        methods = {HttpMethod.GET},
        summary = "List datasets",
        description = "Returns the metadata of every dataset in the registry, in registry order",
        tags = {"datasets"},
        responses = {
            @OpenApiResponse(status = "200", description = "OK", content = @OpenApiContent(from = DatasetMetaDto[].class))
        }
    )
    void listDatasets(final Context ctx) {
        final List<DatasetMetaDto> datasets = queryService.listDatasets().stream()
            .map(DatasetMetaDto::from)
            .toList();
        ctx.status(HttpStatus.OK).json(datasets);
    }

    @OpenApi(
        path = "/datasets/{datasetId}",
        methods = {HttpMethod.GET},
        summary = "Describe a dataset",
        description = "Returns name, description, primary key and column metadata of one dataset",
        tags = {"datasets"},
        pathParams = {
            @OpenApiParam(name = "datasetId", description = "The dataset identifier", required = true)
        },
        responses = {
            @OpenApiResponse(status = "200", description = "OK", content = @OpenApiContent(from = DatasetMetaDto.class)),
            @OpenApiResponse(status = "404", description = "Not found (unknown dataset)", content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void describeDataset(final Context ctx) throws DatasetNotFoundException {
        final String datasetId = ctx.pathParam("datasetId");
        ctx.status(HttpStatus.OK).json(DatasetMetaDto.from(queryService.describe(datasetId)));
    }

    /**
     * Handles a query.
     * <p>
     * Request body: {@code {"filters": [{"column", "op", "value"}], "columns": [...], "limit", "offset"}};
     * an empty body queries the first page of all columns.
     *
     * @param ctx The Javalin context containing request and response data.
     * @throws DatasetNotFoundException  if the dataset does not exist
     * @throws InvalidColumnException    if the projection or a filter names an unknown column
     * @throws StoreUnavailableException if the store could not run the query
     */
    @OpenApi(
        path = "/datasets/{datasetId}/query",
        methods = {HttpMethod.POST},
        summary = "Query a dataset",
        description = "Returns one page of rows matching all filters, projected to the requested columns and ordered by primary key",
        tags = {"datasets"},
        pathParams = {
            @OpenApiParam(name = "datasetId", description = "The dataset identifier", required = true)
        },
        requestBody = @OpenApiRequestBody(
            description = "Filters, projection and pagination; every field is optional",
            content = @OpenApiContent(mimeType = "application/json")
        ),
        responses = {
            @OpenApiResponse(status = "200", description = "OK", content = @OpenApiContent(from = DatasetSliceDto.class)),
            @OpenApiResponse(status = "400", description = "Bad request (malformed body or unknown column)", content = @OpenApiContent(from = ErrorResponseDto.class)),
            @OpenApiResponse(status = "404", description = "Not found (unknown dataset)", content = @OpenApiContent(from = ErrorResponseDto.class)),
            @OpenApiResponse(status = "500", description = "Internal server error (database error)", content = @OpenApiContent(from = ErrorResponseDto.class)),
            @OpenApiResponse(status = "503", description = "Service unavailable (connection pool exhausted)", content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void queryDataset(final Context ctx)
            throws DatasetNotFoundException, InvalidColumnException, StoreUnavailableException {
        final String datasetId = ctx.pathParam("datasetId");
        final QueryRequest request = decoder.decode(ctx.body());

        LOGGER.debug("Querying dataset '{}': filters={}, columns={}, limit={}, offset={}",
            datasetId, request.filters().size(), request.columns(), request.limit(), request.offset());

        final DatasetSlice slice = queryService.query(datasetId, request);
        ctx.status(HttpStatus.OK).json(DatasetSliceDto.from(slice));
    }
}
