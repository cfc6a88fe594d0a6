package org.sportsmcp.dataservice.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.sportsmcp.dataservice.api.query.DatasetSlice;
import org.sportsmcp.dataservice.api.query.SqlStatement;
import org.sportsmcp.dataservice.api.query.StoreUnavailableException;
import org.sportsmcp.dataservice.api.resources.database.IDatasetReader;
import org.sportsmcp.dataservice.api.resources.database.IDatasetReaderProvider;

/**
 * Unit tests for {@link QueryExecutor} with a mocked reader.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class QueryExecutorTest {

    @Mock
    private IDatasetReaderProvider provider;

    @Mock
    private IDatasetReader reader;

    private QueryExecutor executor;
    private TranslatedQuery query;

    @BeforeEach
    void setUp() {
        executor = new QueryExecutor(provider);
        query = new TranslatedQuery("pitching_outings",
            new SqlStatement("SELECT COUNT(*) FROM t", List.of()),
            new SqlStatement("SELECT \"season\" FROM t LIMIT ? OFFSET ?", List.of(2, 0L)),
            List.of("season"));
    }

    @Test
    void execute_buildsPageAndClosesReader() throws Exception {
        when(provider.createReader()).thenReturn(reader);
        when(reader.count(query.countStatement())).thenReturn(4L);
        when(reader.fetch(query.fetchStatement(), query.columns()))
            .thenReturn(List.of(Map.of("season", 2021), Map.of("season", 2022)));

        DatasetSlice slice = executor.execute(query, 2, 0);

        assertThat(slice.datasetId()).isEqualTo("pitching_outings");
        assertThat(slice.total()).isEqualTo(4);
        assertThat(slice.returned()).isEqualTo(2);
        assertThat(slice.offset()).isZero();
        assertThat(slice.nextOffset()).isEqualTo(2L);
        verify(reader).close();
    }

    @Test
    void nextOffset_followsTotalNotRowsReturned() throws Exception {
        when(provider.createReader()).thenReturn(reader);
        when(reader.count(any())).thenReturn(10L);
        when(reader.fetch(any(), anyList())).thenReturn(List.of(Map.of("season", 2021)));

        DatasetSlice slice = executor.execute(query, 2, 4);

        assertThat(slice.returned()).isEqualTo(1);
        assertThat(slice.nextOffset()).isEqualTo(6L);
    }

    @Test
    void nextOffset_isNullOnLastPage() {
        assertThat(QueryExecutor.nextOffset(2, 2, 4)).isNull();
        assertThat(QueryExecutor.nextOffset(0, 100, 4)).isNull();
        assertThat(QueryExecutor.nextOffset(8, 2, 4)).isNull();
        assertThat(QueryExecutor.nextOffset(0, 2, 4)).isEqualTo(2L);
        assertThat(QueryExecutor.nextOffset(0, 1, 0)).isNull();
    }

    @Test
    void nextOffset_doesNotWrapForHugeOffsets() {
        assertThat(QueryExecutor.nextOffset(Long.MAX_VALUE, 100, 4)).isNull();
        assertThat(QueryExecutor.nextOffset(Long.MAX_VALUE - 50, 500, Long.MAX_VALUE)).isNull();
        assertThat(QueryExecutor.nextOffset(Long.MAX_VALUE - 600, 500, Long.MAX_VALUE))
            .isEqualTo(Long.MAX_VALUE - 100);
    }

    @Test
    void failedFetch_closesReaderAndFailsWholeRequest() throws Exception {
        when(provider.createReader()).thenReturn(reader);
        when(reader.count(any())).thenReturn(4L);
        when(reader.fetch(any(), anyList())).thenThrow(new SQLException("relation does not exist"));

        assertThatThrownBy(() -> executor.execute(query, 2, 0))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("pitching_outings")
            .hasMessageContaining("relation does not exist")
            .satisfies(e -> assertThat(((StoreUnavailableException) e).isPoolExhausted()).isFalse());
        verify(reader).close();
    }

    @Test
    void poolTimeout_isReportedAsExhausted() throws Exception {
        when(provider.createReader()).thenThrow(new SQLTransientConnectionException("Connection is not available"));

        assertThatThrownBy(() -> executor.execute(query, 2, 0))
            .isInstanceOf(StoreUnavailableException.class)
            .satisfies(e -> assertThat(((StoreUnavailableException) e).isPoolExhausted()).isTrue());
        verify(reader, never()).close();
    }
}
