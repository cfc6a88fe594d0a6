package org.sportsmcp.node.processes.http.api.datasets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.sportsmcp.dataservice.api.query.DatasetNotFoundException;
import org.sportsmcp.dataservice.api.query.DatasetSlice;
import org.sportsmcp.dataservice.api.query.FilterOp;
import org.sportsmcp.dataservice.api.query.InvalidColumnException;
import org.sportsmcp.dataservice.api.query.QueryRequest;
import org.sportsmcp.dataservice.api.query.StoreUnavailableException;
import org.sportsmcp.dataservice.query.DatasetQueryService;
import org.sportsmcp.node.spi.ServiceRegistry;
import org.sportsmcp.test.utils.PitchingOutingsFixture;

import com.google.gson.Gson;
import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;

/**
 * Tests for the dataset endpoints on DatasetController, with the query service mocked.
 */
@Tag("unit")
class DatasetControllerTest {

    private final Gson gson = new Gson();

    private DatasetQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = mock(DatasetQueryService.class);
    }

    @Test
    void listDatasets_returnsMetadataWithoutStorageNames() throws Exception {
        when(queryService.listDatasets()).thenReturn(List.of(PitchingOutingsFixture.descriptor()));

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.get("/datasets");
            assertThat(response.code()).isEqualTo(200);

            String json = response.body().string();
            List<?> body = gson.fromJson(json, List.class);
            assertThat(body).hasSize(1);
            Map<?, ?> dataset = (Map<?, ?>) body.get(0);
            assertThat(dataset.get("dataset_id")).isEqualTo("pitching_outings");
            assertThat(dataset.get("primary_key")).isEqualTo(List.of("player_id", "game_date"));
            assertThat(((Number) dataset.get("sample_size")).intValue()).isEqualTo(4);
            assertThat(dataset.containsKey("schema")).isFalse();
            assertThat(dataset.containsKey("table")).isFalse();
        });
    }

    @Test
    void describeDataset_returnsColumns() throws Exception {
        when(queryService.describe("pitching_outings")).thenReturn(PitchingOutingsFixture.descriptor());

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.get("/datasets/pitching_outings");
            assertThat(response.code()).isEqualTo(200);

            Map<?, ?> body = gson.fromJson(response.body().string(), Map.class);
            List<?> columns = (List<?>) body.get("columns");
            assertThat(columns).hasSize(6);
            Map<?, ?> outs = (Map<?, ?>) columns.get(5);
            assertThat(outs.get("name")).isEqualTo("outs_recorded");
            assertThat(outs.get("units")).isEqualTo("outs");
        });
    }

    @Test
    void describeDataset_unknownReturns404() throws Exception {
        when(queryService.describe(anyString())).thenThrow(new DatasetNotFoundException("does_not_exist"));

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.get("/datasets/does_not_exist");
            assertThat(response.code()).isEqualTo(404);

            Map<?, ?> body = gson.fromJson(response.body().string(), Map.class);
            assertThat(body.get("kind")).isEqualTo("NOT_FOUND");
            assertThat(body.get("message")).isEqualTo("Dataset not found: does_not_exist");
        });
    }

    @Test
    void queryDataset_decodesBodyAndReturnsSlice() throws Exception {
        DatasetSlice slice = new DatasetSlice("pitching_outings", 3, 2, 0, 2L, List.of(
            Map.of("player_name", "Gerrit Cole"),
            Map.of("player_name", "Shohei Ohtani")));
        when(queryService.query(eq("pitching_outings"), any())).thenReturn(slice);

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.post("/datasets/pitching_outings/query", """
                {"filters": [{"column": "season", "op": "eq", "value": 2021}], "columns": ["player_name"], "limit": 2}
                """);
            assertThat(response.code()).isEqualTo(200);

            Map<?, ?> body = gson.fromJson(response.body().string(), Map.class);
            assertThat(((Number) body.get("total")).intValue()).isEqualTo(3);
            assertThat(((Number) body.get("returned")).intValue()).isEqualTo(2);
            assertThat(((Number) body.get("next_offset")).intValue()).isEqualTo(2);
            assertThat((List<?>) body.get("data")).hasSize(2);
        });

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(queryService).query(eq("pitching_outings"), captor.capture());
        QueryRequest request = captor.getValue();
        assertThat(request.filters()).hasSize(1);
        assertThat(request.filters().get(0).op()).isEqualTo(FilterOp.EQ);
        assertThat(request.filters().get(0).value()).isEqualTo(2021L);
        assertThat(request.columns()).containsExactly("player_name");
        assertThat(request.limit()).isEqualTo(2);
    }

    @Test
    void queryDataset_lastPageWritesNullNextOffset() throws Exception {
        when(queryService.query(eq("pitching_outings"), any()))
            .thenReturn(new DatasetSlice("pitching_outings", 0, 0, 0, null, List.of()));

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.post("/datasets/pitching_outings/query", "");
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.body().string()).contains("\"next_offset\":null");
        });

        verify(queryService).query("pitching_outings", QueryRequest.defaults());
    }

    @Test
    void queryDataset_malformedBodyReturns400() throws Exception {
        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.post("/datasets/pitching_outings/query", "{\"limit\": 501}");
            assertThat(response.code()).isEqualTo(400);

            Map<?, ?> body = gson.fromJson(response.body().string(), Map.class);
            assertThat(body.get("kind")).isEqualTo("MALFORMED_INPUT");
        });

        verifyNoInteractions(queryService);
    }

    @Test
    void queryDataset_invalidColumnReturns400WithColumns() throws Exception {
        when(queryService.query(anyString(), any()))
            .thenThrow(new InvalidColumnException("pitching_outings", List.of("not_a_real_column")));

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.post("/datasets/pitching_outings/query",
                "{\"filters\": [{\"column\": \"not_a_real_column\", \"op\": \"eq\", \"value\": 1}]}");
            assertThat(response.code()).isEqualTo(400);

            Map<?, ?> body = gson.fromJson(response.body().string(), Map.class);
            assertThat(body.get("kind")).isEqualTo("INVALID_COLUMN");
            assertThat(body.get("columns")).isEqualTo(List.of("not_a_real_column"));
        });
    }

    @Test
    void queryDataset_unknownDatasetReturns404() throws Exception {
        when(queryService.query(anyString(), any())).thenThrow(new DatasetNotFoundException("does_not_exist"));

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.post("/datasets/does_not_exist/query", "{}");
            assertThat(response.code()).isEqualTo(404);
        });
    }

    @Test
    void queryDataset_poolTimeoutReturns503() throws Exception {
        when(queryService.query(anyString(), any())).thenThrow(new StoreUnavailableException(
            "Query against dataset 'pitching_outings' failed: timeout",
            new SQLTransientConnectionException("Connection is not available, request timed out after 1000ms")));

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.post("/datasets/pitching_outings/query", "{}");
            assertThat(response.code()).isEqualTo(503);

            Map<?, ?> body = gson.fromJson(response.body().string(), Map.class);
            assertThat(body.get("kind")).isEqualTo("STORE_UNAVAILABLE");
        });
    }

    @Test
    void queryDataset_statementFailureReturns500() throws Exception {
        when(queryService.query(anyString(), any())).thenThrow(new StoreUnavailableException(
            "Query against dataset 'pitching_outings' failed: relation does not exist", new SQLException("relation does not exist")));

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.post("/datasets/pitching_outings/query", "{}");
            assertThat(response.code()).isEqualTo(500);

            Map<?, ?> body = gson.fromJson(response.body().string(), Map.class);
            assertThat(body.get("kind")).isEqualTo("STORE_UNAVAILABLE");
        });
    }

    @Test
    void unexpectedErrorReturnsGeneric500() throws Exception {
        when(queryService.listDatasets()).thenThrow(new IllegalStateException("boom"));

        JavalinTest.test(createApp(), (server, client) -> {
            var response = client.get("/datasets");
            assertThat(response.code()).isEqualTo(500);

            Map<?, ?> body = gson.fromJson(response.body().string(), Map.class);
            assertThat(body.get("kind")).isEqualTo("INTERNAL");
            assertThat(body.get("message")).isEqualTo("Internal server error");
        });
    }

    private Javalin createApp() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.register(DatasetQueryService.class, queryService);
        DatasetController controller = new DatasetController(registry, ConfigFactory.empty());
        Javalin app = Javalin.create();
        controller.registerRoutes(app, "/datasets");
        return app;
    }
}
