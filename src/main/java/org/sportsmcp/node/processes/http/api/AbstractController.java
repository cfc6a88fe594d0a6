package org.sportsmcp.node.processes.http.api;

import org.sportsmcp.dataservice.api.query.DatasetNotFoundException;
import org.sportsmcp.dataservice.api.query.InvalidColumnException;
import org.sportsmcp.dataservice.api.query.MalformedQueryException;
import org.sportsmcp.dataservice.api.query.StoreUnavailableException;
import org.sportsmcp.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpResponseException;
import io.javalin.http.HttpStatus;

/**
 * Base class for controllers serving dataset data.
 * <p>
 * Holds the service registry and controller options, and installs the exception handlers
 * that turn domain exceptions into {@link ErrorResponseDto} bodies:
 * <ul>
 *   <li>{@link DatasetNotFoundException} → 404 {@code NOT_FOUND}</li>
 *   <li>{@link InvalidColumnException} → 400 {@code INVALID_COLUMN}</li>
 *   <li>{@link MalformedQueryException} → 400 {@code MALFORMED_INPUT}</li>
 *   <li>{@link StoreUnavailableException} → 503 if the pool timed out, else 500, {@code STORE_UNAVAILABLE}</li>
 *   <li>anything else → 500 {@code INTERNAL}</li>
 * </ul>
 * Client errors are logged at DEBUG, server-side failures at WARN, each exactly once.
 */
public abstract class AbstractController implements IController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractController.class);

    protected final ServiceRegistry registry;
    protected final Config options;

    /**
     * @param registry The central service registry for accessing shared services.
     * @param options  The HOCON configuration specific to this controller instance.
     */
    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Joins a base path and a suffix, collapsing duplicate slashes.
     */
    protected static String path(final String basePath, final String suffix) {
        final String joined = (basePath + suffix).replaceAll("/{2,}", "/");
        return joined.length() > 1 && joined.endsWith("/") ? joined.substring(0, joined.length() - 1) : joined;
    }

    /**
     * Installs the shared exception handlers. Registering them from several controllers is harmless.
     *
     * @param app the Javalin application
     */
    protected void setupExceptionHandlers(final Javalin app) {
        app.exception(DatasetNotFoundException.class, (e, ctx) -> {
            LOGGER.debug("Dataset not found: {}", e.getDatasetId());
            respond(ctx, HttpStatus.NOT_FOUND, ErrorResponseDto.of(
                HttpStatus.NOT_FOUND.getCode(), HttpStatus.NOT_FOUND.getMessage(), ErrorKind.NOT_FOUND, e.getMessage()));
        });

        app.exception(InvalidColumnException.class, (e, ctx) -> {
            LOGGER.debug("Invalid column(s) for dataset '{}': {}", e.getDatasetId(), e.getColumns());
            respond(ctx, HttpStatus.BAD_REQUEST, ErrorResponseDto.of(
                HttpStatus.BAD_REQUEST.getCode(), HttpStatus.BAD_REQUEST.getMessage(), ErrorKind.INVALID_COLUMN,
                e.getMessage(), e.getColumns()));
        });

        app.exception(MalformedQueryException.class, (e, ctx) -> {
            LOGGER.debug("Malformed request to {}: {}", ctx.path(), e.getMessage());
            respond(ctx, HttpStatus.BAD_REQUEST, ErrorResponseDto.of(
                HttpStatus.BAD_REQUEST.getCode(), HttpStatus.BAD_REQUEST.getMessage(), ErrorKind.MALFORMED_INPUT,
                e.getMessage()));
        });

        app.exception(StoreUnavailableException.class, (e, ctx) -> {
            final HttpStatus status = e.isPoolExhausted() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
            LOGGER.warn("Store unavailable for {}: {}", ctx.path(), e.getMessage());
            respond(ctx, status, ErrorResponseDto.of(
                status.getCode(), status.getMessage(), ErrorKind.STORE_UNAVAILABLE, e.getMessage()));
        });

        app.exception(Exception.class, (e, ctx) -> {
            if (e instanceof HttpResponseException httpException) {
                final HttpStatus status = HttpStatus.forStatus(httpException.getStatus());
                final ErrorKind kind = status == HttpStatus.NOT_FOUND ? ErrorKind.NOT_FOUND
                    : status.getCode() < 500 ? ErrorKind.MALFORMED_INPUT : ErrorKind.INTERNAL;
                respond(ctx, status, ErrorResponseDto.of(
                    status.getCode(), status.getMessage(), kind, httpException.getMessage()));
                return;
            }
            LOGGER.warn("Unhandled error for {} {}: {}", ctx.method(), ctx.path(), e.getMessage(), e);
            respond(ctx, HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponseDto.of(
                HttpStatus.INTERNAL_SERVER_ERROR.getCode(), HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                ErrorKind.INTERNAL, "Internal server error"));
        });
    }

    private static void respond(final Context ctx, final HttpStatus status, final ErrorResponseDto body) {
        ctx.status(status).json(body);
    }
}
