package org.sportsmcp.node.processes;

import java.util.Map;

import org.sportsmcp.node.spi.IProcess;

import com.typesafe.config.Config;

/**
 * Base class for node processes holding the constructor arguments every process receives.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  The name of this process instance from the configuration.
     * @param dependencies Services exposed by the required processes, keyed by dependency name.
     * @param options      The {@code options} block of this process.
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = Map.copyOf(dependencies);
        this.options = options;
    }

    /**
     * Returns a required dependency, checking its type.
     *
     * @param key  dependency key from the {@code require} block
     * @param type expected type
     * @param <T>  expected type
     * @return the dependency
     * @throws IllegalStateException if the dependency is missing or has the wrong type
     */
    protected <T> T getDependency(final String key, final Class<T> type) {
        final Object dependency = dependencies.get(key);
        if (dependency == null) {
            throw new IllegalStateException(
                "Process '" + processName + "' requires dependency '" + key + "' but none was provided.");
        }
        if (!type.isInstance(dependency)) {
            throw new IllegalStateException(String.format(
                "Process '%s' expects dependency '%s' of type %s but got %s.",
                processName, key, type.getName(), dependency.getClass().getName()));
        }
        return type.cast(dependency);
    }

    public String getProcessName() {
        return processName;
    }
}
