package org.empiresim.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed holder of the shared services handed to controllers.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * @param type     Type under which the service is registered.
     * @param instance The service.
     * @throws IllegalArgumentException if a service of this type is already registered.
     */
    public void register(final Class<?> type, final Object instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * @throws IllegalArgumentException if no service of this type is registered.
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }

    public boolean hasService(final Class<?> type) {
        return services.containsKey(type);
    }
}
