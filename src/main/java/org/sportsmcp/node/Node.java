package org.sportsmcp.node;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.sportsmcp.node.spi.IProcess;
import org.sportsmcp.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Hosts the configured {@link IProcess} instances and drives their lifecycle.
 * <p>
 * Processes are declared under {@code node.processes}:
 * <pre>
 * node {
 *   processes {
 *     datasets {
 *       className = "org.sportsmcp.node.processes.datasets.DatasetServiceProcess"
 *       options { ... }
 *     }
 *     http {
 *       className = "org.sportsmcp.node.processes.http.HttpServerProcess"
 *       require { services = "datasets" }
 *       options { ... }
 *     }
 *   }
 * }
 * </pre>
 * Each {@code require} entry maps a dependency key to the name of another process, which must
 * implement {@link IServiceProvider}. Processes are constructed and started in dependency order
 * (ties broken by name) and stopped in reverse.
 * <p>
 * Construction is all-or-nothing: a process that cannot be created aborts the node, and
 * already created processes are stopped again. A node that starts always serves a complete
 * configuration.
 */
public class Node {

    private static final Logger log = LoggerFactory.getLogger(Node.class);

    private static final String PROCESSES_PATH = "node.processes";

    private final Map<String, IProcess> processes = new LinkedHashMap<>();
    private final List<String> startedProcesses = new ArrayList<>();

    /**
     * Creates all configured processes.
     *
     * @param config the fully resolved application configuration
     * @throws IllegalStateException if the process graph is invalid or a process fails to initialize
     */
    public Node(final Config config) {
        if (!config.hasPath(PROCESSES_PATH)) {
            log.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_PATH);
            return;
        }

        final Config processesConfig = config.getConfig(PROCESSES_PATH);
        final Map<String, Config> declared = new TreeMap<>();
        for (final String name : processesConfig.root().keySet()) {
            declared.put(name, processesConfig.getConfig(quote(name)));
        }

        for (final String name : resolveStartOrder(declared)) {
            try {
                processes.put(name, createProcess(name, declared.get(name)));
                log.debug("Initialized process '{}'", name);
            } catch (final Exception e) {
                final Throwable rootCause = rootCause(e);
                log.error("Failed to initialize process '{}': {}", name, rootCause.getMessage());
                stopAll(new ArrayList<>(processes.keySet()));
                processes.clear();
                throw new IllegalStateException("Failed to initialize process '" + name + "': "
                    + rootCause.getMessage(), e);
            }
        }
    }

    /**
     * Starts all processes in dependency order.
     *
     * @throws IllegalStateException if a process fails to start; processes started before it are stopped again
     */
    public void start() {
        if (processes.isEmpty()) {
            log.warn("No processes configured to start. The node will be idle.");
            return;
        }
        for (final Map.Entry<String, IProcess> entry : processes.entrySet()) {
            try {
                entry.getValue().start();
                startedProcesses.add(entry.getKey());
                log.debug("Started process '{}'", entry.getKey());
            } catch (final RuntimeException e) {
                log.error("Failed to start process '{}': {}", entry.getKey(), rootCause(e).getMessage());
                stop();
                throw new IllegalStateException("Failed to start process '" + entry.getKey() + "'", e);
            }
        }
        log.info("Node started with {} process(es): {}", processes.size(), processes.keySet());
    }

    /**
     * Stops all started processes in reverse start order. Safe to call more than once.
     */
    public void stop() {
        if (startedProcesses.isEmpty()) {
            return;
        }
        final List<String> toStop = new ArrayList<>(startedProcesses);
        startedProcesses.clear();
        stopAll(toStop);
        log.info("Node stopped");
    }

    /**
     * @return process names in start order
     */
    public List<String> getProcessNames() {
        return List.copyOf(processes.keySet());
    }

    /**
     * @param name process name
     * @return the process instance, or {@code null} if no such process exists
     */
    public IProcess getProcess(final String name) {
        return processes.get(name);
    }

    private void stopAll(final List<String> names) {
        final List<String> reversed = new ArrayList<>(names);
        Collections.reverse(reversed);
        for (final String name : reversed) {
            try {
                processes.get(name).stop();
                log.debug("Stopped process '{}'", name);
            } catch (final RuntimeException e) {
                log.error("Error while stopping process '{}': {}", name, rootCause(e).getMessage());
            }
        }
    }

    private IProcess createProcess(final String name, final Config processConfig) throws ReflectiveOperationException {
        final String className = processConfig.getString("className");
        final Config options = processConfig.hasPath("options")
            ? processConfig.getConfig("options")
            : ConfigFactory.empty();

        final Map<String, Object> dependencies = new HashMap<>();
        for (final Map.Entry<String, String> requirement : requirements(processConfig).entrySet()) {
            final IProcess provider = processes.get(requirement.getValue());
            if (!(provider instanceof IServiceProvider serviceProvider)) {
                throw new IllegalStateException(String.format(
                    "Process '%s' requires '%s', which does not expose a service",
                    name, requirement.getValue()));
            }
            dependencies.put(requirement.getKey(), serviceProvider.getExposedService());
        }

        final Class<?> clazz = Class.forName(className);
        if (!IProcess.class.isAssignableFrom(clazz)) {
            throw new IllegalStateException("Class " + className + " does not implement IProcess");
        }
        final Constructor<?> constructor = clazz.getDeclaredConstructor(String.class, Map.class, Config.class);
        constructor.setAccessible(true);
        try {
            return (IProcess) constructor.newInstance(name, dependencies, options);
        } catch (final InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    /**
     * Orders processes so every process comes after the processes it requires.
     */
    static List<String> resolveStartOrder(final Map<String, Config> declared) {
        final List<String> order = new ArrayList<>(declared.size());
        final Set<String> visiting = new LinkedHashSet<>();
        for (final String name : declared.keySet()) {
            visit(name, declared, visiting, order);
        }
        return order;
    }

    private static void visit(final String name, final Map<String, Config> declared,
                              final Set<String> visiting, final List<String> order) {
        if (order.contains(name)) {
            return;
        }
        if (!visiting.add(name)) {
            throw new IllegalStateException("Circular process dependency: " + String.join(" -> ", visiting) + " -> " + name);
        }
        for (final String required : new TreeMap<>(requirements(declared.get(name))).values()) {
            if (!declared.containsKey(required)) {
                throw new IllegalStateException(
                    "Process '" + name + "' requires unknown process '" + required + "'");
            }
            visit(required, declared, visiting, order);
        }
        visiting.remove(name);
        order.add(name);
    }

    private static Map<String, String> requirements(final Config processConfig) {
        if (!processConfig.hasPath("require")) {
            return Map.of();
        }
        final Config require = processConfig.getConfig("require");
        final Map<String, String> result = new LinkedHashMap<>();
        for (final String key : new TreeMap<>(require.root().unwrapped()).keySet()) {
            result.put(key, require.getString(quote(key)));
        }
        return result;
    }

    private static String quote(final String key) {
        return "\"" + key + "\"";
    }

    private static Throwable rootCause(final Throwable t) {
        Throwable current = t;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
