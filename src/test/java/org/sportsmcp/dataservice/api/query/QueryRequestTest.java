package org.sportsmcp.dataservice.api.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class QueryRequestTest {

    @Test
    void defaults_areFirstPageOfAllColumns() {
        QueryRequest request = QueryRequest.defaults();

        assertThat(request.filters()).isEmpty();
        assertThat(request.columns()).isNull();
        assertThat(request.limit()).isEqualTo(100);
        assertThat(request.offset()).isZero();
    }

    @Test
    void checkBounds_acceptsLimitsAtTheEdges() {
        assertThatCode(() -> QueryRequest.defaults().withLimit(1).checkBounds()).doesNotThrowAnyException();
        assertThatCode(() -> QueryRequest.defaults().withLimit(500).checkBounds()).doesNotThrowAnyException();
    }

    @Test
    void checkBounds_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> QueryRequest.defaults().withLimit(0).checkBounds())
            .isInstanceOf(MalformedQueryException.class)
            .hasMessageContaining("limit");
        assertThatThrownBy(() -> QueryRequest.defaults().withLimit(501).checkBounds())
            .isInstanceOf(MalformedQueryException.class);
        assertThatThrownBy(() -> QueryRequest.defaults().withOffset(-1).checkBounds())
            .isInstanceOf(MalformedQueryException.class)
            .hasMessageContaining("offset");
    }

    @Test
    void filterOp_parsesWireNamesOnly() {
        assertThat(FilterOp.fromWireName("eq")).isEqualTo(FilterOp.EQ);
        assertThat(FilterOp.fromWireName("gte")).isEqualTo(FilterOp.GTE);
        assertThat(FilterOp.fromWireName("lte")).isEqualTo(FilterOp.LTE);
        assertThatThrownBy(() -> FilterOp.fromWireName("EQ")).isInstanceOf(MalformedQueryException.class);
        assertThatThrownBy(() -> FilterOp.fromWireName("neq"))
            .isInstanceOf(MalformedQueryException.class)
            .hasMessageContaining("neq");
    }
}
