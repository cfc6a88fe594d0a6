package org.sportsmcp.node.processes.http.api.datasets;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.sportsmcp.dataservice.api.query.FilterOp;
import org.sportsmcp.dataservice.api.query.MalformedQueryException;
import org.sportsmcp.dataservice.api.query.QueryFilter;
import org.sportsmcp.dataservice.api.query.QueryRequest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decodes a query request body into a {@link QueryRequest}.
 * <p>
 * Request format (every field optional, unknown fields ignored):
 * <pre>
 * {
 *   "filters": [{"column": "season", "op": "eq", "value": 2021}],
 *   "columns": ["player_name", "earned_runs"],
 *   "limit": 100,
 *   "offset": 0
 * }
 * </pre>
 * Structural problems are reported as {@link MalformedQueryException}. Column names are not
 * checked against the dataset here.
 */
public class DatasetQueryDecoder {

    private final ObjectMapper objectMapper;

    public DatasetQueryDecoder() {
        this(new ObjectMapper());
    }

    public DatasetQueryDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param body raw request body, may be empty
     * @return the decoded request; defaults for an empty body
     * @throws MalformedQueryException if the body violates the request format
     */
    public QueryRequest decode(String body) {
        if (body == null || body.isBlank()) {
            return QueryRequest.defaults();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedQueryException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return QueryRequest.defaults();
        }
        if (!root.isObject()) {
            throw new MalformedQueryException("Request body must be a JSON object");
        }

        return new QueryRequest(
            decodeFilters(root.get("filters")),
            decodeColumns(root.get("columns")),
            decodeLimit(root.get("limit")),
            decodeOffset(root.get("offset")));
    }

    private List<QueryFilter> decodeFilters(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedQueryException("'filters' must be an array");
        }
        List<QueryFilter> filters = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            filters.add(decodeFilter(node.get(i), i));
        }
        return filters;
    }

    private QueryFilter decodeFilter(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new MalformedQueryException("filters[" + index + "] must be an object");
        }
        JsonNode column = node.get("column");
        if (column == null || !column.isTextual()) {
            throw new MalformedQueryException("filters[" + index + "].column must be a string");
        }
        JsonNode op = node.get("op");
        if (op == null || !op.isTextual()) {
            throw new MalformedQueryException("filters[" + index + "].op must be a string");
        }
        if (!node.has("value")) {
            throw new MalformedQueryException("filters[" + index + "].value is required");
        }
        return new QueryFilter(column.asText(), FilterOp.fromWireName(op.asText()), scalarValue(node.get("value"), index));
    }

    private static Object scalarValue(JsonNode value, int index) {
        if (value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        throw new MalformedQueryException("filters[" + index + "].value must be a string, number, boolean or null");
    }

    private static List<String> decodeColumns(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new MalformedQueryException("'columns' must be an array of strings");
        }
        Set<String> columns = new LinkedHashSet<>();
        for (JsonNode column : node) {
            if (!column.isTextual()) {
                throw new MalformedQueryException("'columns' must be an array of strings");
            }
            if (!columns.add(column.asText())) {
                throw new MalformedQueryException("Duplicate column '" + column.asText() + "' in 'columns'");
            }
        }
        return List.copyOf(columns);
    }

    private static int decodeLimit(JsonNode node) {
        if (node == null || node.isNull()) {
            return QueryRequest.DEFAULT_LIMIT;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()
                || node.intValue() < QueryRequest.MIN_LIMIT || node.intValue() > QueryRequest.MAX_LIMIT) {
            throw new MalformedQueryException(String.format("'limit' must be an integer between %d and %d",
                QueryRequest.MIN_LIMIT, QueryRequest.MAX_LIMIT));
        }
        return node.intValue();
    }

    private static long decodeOffset(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0L;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong() || node.longValue() < 0) {
            throw new MalformedQueryException("'offset' must be a non-negative integer");
        }
        return node.longValue();
    }
}
