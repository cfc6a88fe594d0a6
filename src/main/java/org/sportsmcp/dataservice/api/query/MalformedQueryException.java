package org.sportsmcp.dataservice.api.query;

/**
 * Thrown when a query request is structurally invalid: wrong JSON types, an unsupported
 * filter operator, or {@code limit}/{@code offset} outside their bounds.
 * <p>
 * Normally raised while decoding the request at the transport boundary. The query service
 * re-checks the numeric bounds so the core never runs with out-of-range values.
 */
public class MalformedQueryException extends IllegalArgumentException {

    /**
     * @param message description of the structural problem
     */
    public MalformedQueryException(String message) {
        super(message);
    }

    /**
     * @param message description of the structural problem
     * @param cause   the underlying parse failure
     */
    public MalformedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
