package org.sportsmcp.node.processes.http.api;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON body of every error response.
 * <p>
 * {@code columns} is only present for {@link ErrorKind#INVALID_COLUMN} errors.
 *
 * @param timestamp ISO-8601 instant the error was produced
 * @param status    HTTP status code
 * @param error     HTTP reason phrase
 * @param kind      error category
 * @param message   human-readable description
 * @param columns   offending column names, or {@code null}
 */
public record ErrorResponseDto(
    String timestamp,
    int status,
    String error,
    ErrorKind kind,
    String message,
    @JsonInclude(JsonInclude.Include.NON_NULL) List<String> columns
) {

    public static ErrorResponseDto of(int status, String error, ErrorKind kind, String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, kind, message, null);
    }

    public static ErrorResponseDto of(int status, String error, ErrorKind kind, String message, List<String> columns) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, kind, message, List.copyOf(columns));
    }
}
