package org.sportsmcp.node.processes.http.api.datasets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.sportsmcp.dataservice.api.query.FilterOp;
import org.sportsmcp.dataservice.api.query.MalformedQueryException;
import org.sportsmcp.dataservice.api.query.QueryFilter;
import org.sportsmcp.dataservice.api.query.QueryRequest;

@Tag("unit")
@DisplayName("DatasetQueryDecoder")
class DatasetQueryDecoderTest {

    private final DatasetQueryDecoder decoder = new DatasetQueryDecoder();

    @Nested
    @DisplayName("Accepted bodies")
    class Accepted {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "null", "{}"})
        void emptyBodiesYieldDefaults(String body) {
            assertThat(decoder.decode(body)).isEqualTo(QueryRequest.defaults());
        }

        @Test
        void nullBodyYieldsDefaults() {
            assertThat(decoder.decode(null)).isEqualTo(QueryRequest.defaults());
        }

        @Test
        void decodesFullRequest() {
            QueryRequest request = decoder.decode("""
                {
                  "filters": [
                    {"column": "season", "op": "eq", "value": 2021},
                    {"column": "game_date", "op": "gte", "value": "2021-04-02"},
                    {"column": "era", "op": "lte", "value": 3.5}
                  ],
                  "columns": ["player_name", "earned_runs"],
                  "limit": 2,
                  "offset": 4,
                  "ignored": true
                }
                """);

            assertThat(request.filters()).containsExactly(
                new QueryFilter("season", FilterOp.EQ, 2021L),
                new QueryFilter("game_date", FilterOp.GTE, "2021-04-02"),
                new QueryFilter("era", FilterOp.LTE, 3.5));
            assertThat(request.columns()).containsExactly("player_name", "earned_runs");
            assertThat(request.limit()).isEqualTo(2);
            assertThat(request.offset()).isEqualTo(4L);
        }

        @Test
        void keepsNullAndBooleanValues() {
            QueryRequest request = decoder.decode("""
                {"filters": [{"column": "a", "op": "eq", "value": null}, {"column": "b", "op": "eq", "value": true}]}
                """);

            assertThat(request.filters()).extracting(QueryFilter::value).containsExactly(null, true);
        }

        @Test
        void keepsLargeIntegersExact() {
            QueryRequest request = decoder.decode("""
                {"filters": [{"column": "a", "op": "eq", "value": 123456789012345678901234567890}]}
                """);

            assertThat(request.filters().get(0).value()).isEqualTo(new BigInteger("123456789012345678901234567890"));
        }

        @Test
        void emptyColumnsArrayIsKept() {
            assertThat(decoder.decode("{\"columns\": []}").columns()).isEmpty();
        }

        @Test
        void acceptsLimitBounds() {
            assertThat(decoder.decode("{\"limit\": 1}").limit()).isEqualTo(1);
            assertThat(decoder.decode("{\"limit\": 500}").limit()).isEqualTo(500);
        }
    }

    @Nested
    @DisplayName("Rejected bodies")
    class Rejected {

        @ParameterizedTest
        @ValueSource(strings = {
            "{not json",
            "[1, 2]",
            "{\"filters\": {}}",
            "{\"filters\": [1]}",
            "{\"filters\": [{\"op\": \"eq\", \"value\": 1}]}",
            "{\"filters\": [{\"column\": \"a\", \"value\": 1}]}",
            "{\"filters\": [{\"column\": \"a\", \"op\": \"eq\"}]}",
            "{\"filters\": [{\"column\": \"a\", \"op\": \"eq\", \"value\": [1]}]}",
            "{\"filters\": [{\"column\": \"a\", \"op\": \"eq\", \"value\": {\"x\": 1}}]}",
            "{\"filters\": [{\"column\": \"a\", \"op\": \"like\", \"value\": 1}]}",
            "{\"filters\": [{\"column\": \"a\", \"op\": \"EQ\", \"value\": 1}]}",
            "{\"columns\": \"a\"}",
            "{\"columns\": [1]}",
            "{\"limit\": 0}",
            "{\"limit\": 501}",
            "{\"limit\": 10.0}",
            "{\"limit\": \"10\"}",
            "{\"offset\": -1}",
            "{\"offset\": 1.5}"
        })
        void rejectsMalformedBodies(String body) {
            assertThatThrownBy(() -> decoder.decode(body)).isInstanceOf(MalformedQueryException.class);
        }

        @Test
        void namesTheOffendingFilter() {
            assertThatThrownBy(() -> decoder.decode(
                "{\"filters\": [{\"column\": \"a\", \"op\": \"eq\", \"value\": 1}, {\"column\": \"b\", \"op\": \"eq\"}]}"))
                .hasMessage("filters[1].value is required");
        }

        @Test
        void rejectsDuplicateColumns() {
            assertThatThrownBy(() -> decoder.decode("{\"columns\": [\"a\", \"b\", \"a\"]}"))
                .isInstanceOf(MalformedQueryException.class)
                .hasMessage("Duplicate column 'a' in 'columns'");
        }

        @Test
        void reportsLimitRange() {
            assertThatThrownBy(() -> decoder.decode("{\"limit\": 1000}"))
                .hasMessage("'limit' must be an integer between 1 and 500");
        }
    }

    @Test
    void doesNotCheckColumnNames() {
        assertThat(decoder.decode("{\"columns\": [\"not_a_real_column\"]}").columns())
            .isEqualTo(List.of("not_a_real_column"));
    }
}
