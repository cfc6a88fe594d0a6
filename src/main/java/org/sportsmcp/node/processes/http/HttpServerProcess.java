package org.sportsmcp.node.processes.http;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.sportsmcp.node.processes.AbstractProcess;
import org.sportsmcp.node.processes.http.api.IController;
import org.sportsmcp.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;

/**
 * Node process running the Javalin HTTP server.
 * <p>
 * Controllers are declared in configuration and instantiated reflectively with the
 * {@link ServiceRegistry} exposed by the required {@code services} process:
 * <pre>
 * http {
 *   className = "org.sportsmcp.node.processes.http.HttpServerProcess"
 *   require { services = "datasets" }
 *   options {
 *     host = "0.0.0.0"
 *     port = 8000
 *     controllers = [
 *       { className = "org.sportsmcp.node.processes.http.api.health.HealthController", basePath = "/healthz" }
 *       { className = "org.sportsmcp.node.processes.http.api.datasets.DatasetController", basePath = "/datasets" }
 *     ]
 *   }
 * }
 * </pre>
 * Controllers are created in the constructor, so a misconfigured controller fails node startup
 * before any port is bound. The server binds in {@link #start()}.
 */
public class HttpServerProcess extends AbstractProcess {

    private static final Logger log = LoggerFactory.getLogger(HttpServerProcess.class);

    private final String host;
    private final int port;
    private final Javalin app;

    /**
     * @param processName  The name of this process instance from the configuration.
     * @param dependencies Must contain {@code services}, a {@link ServiceRegistry}.
     * @param options      Server and controller configuration.
     */
    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.host = options.hasPath("host") ? options.getString("host") : "0.0.0.0";
        this.port = options.hasPath("port") ? options.getInt("port") : 8000;

        final ServiceRegistry registry = getDependency("services", ServiceRegistry.class);

        this.app = Javalin.create(config -> config.showJavalinBanner = false);

        final List<? extends Config> controllerConfigs = options.hasPath("controllers")
            ? options.getConfigList("controllers")
            : List.of();
        if (controllerConfigs.isEmpty()) {
            log.warn("HTTP server '{}' has no controllers configured; every request will return 404", processName);
        }
        final List<String> mounted = new ArrayList<>();
        for (final Config controllerConfig : controllerConfigs) {
            final String className = controllerConfig.getString("className");
            final String basePath = controllerConfig.hasPath("basePath") ? controllerConfig.getString("basePath") : "/";
            final Config controllerOptions = controllerConfig.hasPath("options")
                ? controllerConfig.getConfig("options")
                : ConfigFactory.empty();

            createController(className, registry, controllerOptions).registerRoutes(app, basePath);
            mounted.add(basePath + " -> " + className.substring(className.lastIndexOf('.') + 1));
        }
        log.debug("HTTP server '{}' mounted controllers: {}", processName, mounted);
    }

    private static IController createController(final String className, final ServiceRegistry registry,
                                                final Config options) {
        try {
            final Class<?> clazz = Class.forName(className);
            if (!IController.class.isAssignableFrom(clazz)) {
                throw new IllegalStateException("Class " + className + " does not implement IController");
            }
            final Constructor<?> constructor = clazz.getConstructor(ServiceRegistry.class, Config.class);
            return (IController) constructor.newInstance(registry, options);
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Failed to create controller " + className + ": " + cause.getMessage(), cause);
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create controller " + className + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void start() {
        app.start(host, port);
        log.info("HTTP server '{}' listening on {}:{}", processName, host, app.port());
    }

    @Override
    public void stop() {
        app.stop();
        log.debug("HTTP server '{}' stopped", processName);
    }

    /**
     * @return the bound port; differs from the configured one when that was 0
     */
    public int getPort() {
        return app.port();
    }
}
