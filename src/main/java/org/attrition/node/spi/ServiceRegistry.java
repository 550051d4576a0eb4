package org.attrition.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed singletons handed to controllers.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the type is already registered
     */
    public <T> void register(final Class<T> type, final T instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * @throws IllegalArgumentException if nothing is registered for the type
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }
}
