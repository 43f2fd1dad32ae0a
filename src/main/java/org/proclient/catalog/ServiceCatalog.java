package org.proclient.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, name-keyed view of every service the client knows about.
 * <p>
 * Iteration order is the order in which services were declared, which is also the
 * order used by {@code pro status}. Instances are safe to share between threads.
 */
public final class ServiceCatalog {

    private final Map<String, Service> services;

    /**
     * Creates a catalog from the given services.
     *
     * @param services The services to include, in display order.
     * @throws IllegalArgumentException if two services share a name or a service
     *                                  references an unknown required/incompatible service.
     */
    public ServiceCatalog(final Collection<Service> services) {
        final Map<String, Service> byName = new LinkedHashMap<>();
        for (final Service service : services) {
            if (byName.putIfAbsent(service.name(), service) != null) {
                throw new IllegalArgumentException("Duplicate service name in catalog: " + service.name());
            }
        }
        for (final Service service : byName.values()) {
            checkReferences(byName, service, service.requiredServices());
            checkReferences(byName, service, service.incompatibleServices());
        }
        this.services = Collections.unmodifiableMap(byName);
    }

    private static void checkReferences(final Map<String, Service> byName, final Service owner, final List<String> names) {
        for (final String name : names) {
            if (!byName.containsKey(name)) {
                throw new IllegalArgumentException(
                    "Service '" + owner.name() + "' references unknown service '" + name + "'");
            }
        }
    }

    /**
     * Looks up a service by its exact, case-sensitive name.
     *
     * @param name The service name.
     * @return The service, or empty if the name is not in the catalog.
     */
    public Optional<Service> find(final String name) {
        return Optional.ofNullable(services.get(name));
    }

    public boolean contains(final String name) {
        return services.containsKey(name);
    }

    /**
     * Returns the service with the given name.
     *
     * @param name The service name.
     * @return The service.
     * @throws IllegalArgumentException if the name is not in the catalog.
     */
    public Service get(final String name) {
        final Service service = services.get(name);
        if (service == null) {
            throw new IllegalArgumentException("No service named '" + name + "' in catalog");
        }
        return service;
    }

    public List<Service> all() {
        return List.copyOf(services.values());
    }

    /**
     * Returns the services that list the given service as required, i.e. the services
     * that must be disabled before it can be disabled.
     *
     * @param name The service name.
     * @return The dependent services in catalog order.
     */
    public List<Service> dependentsOf(final String name) {
        final List<Service> dependents = new ArrayList<>();
        for (final Service service : services.values()) {
            if (service.requiredServices().contains(name)) {
                dependents.add(service);
            }
        }
        return dependents;
    }

    /**
     * Orders the given services so that every service comes after the services it requires.
     * Used for enabling. The result for disabling is the reverse.
     *
     * @param names The service names to order.
     * @return The names in dependency order, stable with respect to catalog order.
     */
    public List<String> enableOrder(final Collection<String> names) {
        final List<String> order = new ArrayList<>();
        for (final Service service : services.values()) {
            if (names.contains(service.name())) {
                visit(service, names, order);
            }
        }
        return order;
    }

    /**
     * Orders the given services so that dependents are disabled before the services they require.
     *
     * @param names The service names to order.
     * @return The names in disable order.
     */
    public List<String> disableOrder(final Collection<String> names) {
        final List<String> order = new ArrayList<>(enableOrder(names));
        Collections.reverse(order);
        return order;
    }

    private void visit(final Service service, final Collection<String> names, final List<String> order) {
        if (order.contains(service.name())) {
            return;
        }
        for (final String required : service.requiredServices()) {
            if (names.contains(required)) {
                visit(services.get(required), names, order);
            }
        }
        order.add(service.name());
    }
}
