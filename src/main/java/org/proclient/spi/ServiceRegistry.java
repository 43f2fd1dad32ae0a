package org.proclient.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Type-keyed holder of the collaborators a command needs: the catalog, the state store,
 * the contract client and so on.
 * <p>
 * Collaborators can be registered eagerly or as suppliers that run on first lookup, so a
 * command only pays for what it uses (e.g. {@code pro help} never reads the state file).
 * Tests register fakes under the same types.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Supplier<?>> suppliers = new ConcurrentHashMap<>();
    private final Map<Class<?>, Object> instances = new ConcurrentHashMap<>();

    /**
     * Registers a ready instance.
     *
     * @param type     The type under which to register, typically an interface.
     * @param instance The instance.
     * @param <T>      The registered type.
     * @return This registry, for chaining.
     * @throws IllegalArgumentException if the type is already registered.
     */
    public <T> ServiceRegistry register(final Class<T> type, final T instance) {
        ensureAbsent(type);
        instances.put(type, instance);
        return this;
    }

    /**
     * Registers a supplier that creates the instance on first lookup.
     *
     * @param type     The type under which to register.
     * @param supplier Creates the instance; called at most once.
     * @param <T>      The registered type.
     * @return This registry, for chaining.
     * @throws IllegalArgumentException if the type is already registered.
     */
    public <T> ServiceRegistry registerLazy(final Class<T> type, final Supplier<? extends T> supplier) {
        ensureAbsent(type);
        suppliers.put(type, supplier);
        return this;
    }

    /**
     * Retrieves a collaborator, creating it if it was registered lazily.
     *
     * @param type The registered type.
     * @param <T>  The registered type.
     * @return The instance.
     * @throws IllegalArgumentException if nothing is registered for the type.
     */
    public synchronized <T> T get(final Class<T> type) {
        Object instance = instances.get(type);
        if (instance == null) {
            final Supplier<?> supplier = suppliers.get(type);
            if (supplier == null) {
                throw new IllegalArgumentException("No service registered for type " + type.getName());
            }
            // Suppliers may call get() themselves; keep them outside any map update.
            instance = supplier.get();
            instances.put(type, instance);
        }
        return type.cast(instance);
    }

    public boolean hasService(final Class<?> type) {
        return instances.containsKey(type) || suppliers.containsKey(type);
    }

    private void ensureAbsent(final Class<?> type) {
        if (hasService(type)) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }
}
