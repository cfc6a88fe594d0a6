package org.sportsmcp.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed lookup of shared services.
 * <p>
 * Populated by the process that owns the services during its construction and handed to HTTP
 * controllers, which look up what they need by interface.
 * <p>
 * <strong>Thread Safety:</strong> backed by a {@link ConcurrentHashMap}; registration and
 * lookup may happen from different threads.
 */
public class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * Registers a service under the given type, replacing any previous registration.
     *
     * @param type    lookup key
     * @param service implementation
     * @param <T>     service type
     */
    public <T> void register(final Class<T> type, final T service) {
        if (type == null || service == null) {
            throw new IllegalArgumentException("Service type and instance must not be null");
        }
        services.put(type, service);
    }

    /**
     * Looks up a registered service.
     *
     * @param type lookup key
     * @param <T>  service type
     * @return the service
     * @throws IllegalStateException if nothing is registered under {@code type}
     */
    public <T> T get(final Class<T> type) {
        final Object service = services.get(type);
        if (service == null) {
            throw new IllegalStateException("No service registered for type " + type.getName());
        }
        return type.cast(service);
    }

    /**
     * @param type lookup key
     * @return {@code true} if a service is registered under {@code type}
     */
    public boolean contains(final Class<?> type) {
        return services.containsKey(type);
    }
}
