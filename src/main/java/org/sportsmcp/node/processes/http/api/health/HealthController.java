package org.sportsmcp.node.processes.http.api.health;

import java.util.Map;

import org.sportsmcp.node.processes.http.api.AbstractController;
import org.sportsmcp.node.spi.ServiceRegistry;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiResponse;

/**
 * Liveness probe. Answers without touching the database.
 */
public class HealthController extends AbstractController {

    private static final Map<String, String> OK = Map.of("status", "ok");

    public HealthController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, "/"), this::health);
    }

    @OpenApi(
        path = "/healthz",
        methods = {HttpMethod.GET},
        summary = "Liveness check",
        tags = {"health"},
        responses = {
            @OpenApiResponse(status = "200", description = "OK", content = @OpenApiContent(from = Map.class))
        }
    )
    void health(final Context ctx) {
        ctx.status(HttpStatus.OK).json(OK);
    }
}
