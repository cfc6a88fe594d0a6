package org.sportsmcp.node.processes.http.api;

/**
 * Machine-readable error category carried in every error response.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_COLUMN,
    MALFORMED_INPUT,
    STORE_UNAVAILABLE,
    INTERNAL
}
