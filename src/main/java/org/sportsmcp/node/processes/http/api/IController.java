package org.sportsmcp.node.processes.http.api;

import io.javalin.Javalin;

/**
 * An HTTP controller mounted by the {@link org.sportsmcp.node.processes.http.HttpServerProcess}.
 * <p>
 * Implementations provide a public constructor {@code (ServiceRegistry registry, Config options)}.
 */
public interface IController {

    /**
     * Registers the controller's routes and exception handlers.
     *
     * @param app      the Javalin application
     * @param basePath path prefix configured for this controller
     */
    void registerRoutes(Javalin app, String basePath);
}
