package org.proclient.operation;

import org.proclient.catalog.Service;
import org.proclient.catalog.ServiceCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits requested service names into known and unknown ones.
 * <p>
 * Matching is exact and case-sensitive. Beta services only count as known when beta
 * services are allowed, otherwise they are indistinguishable from names the catalog
 * has never heard of. Unknown names are not rejected here; they are carried forward
 * so they can take part in the aggregated message.
 */
public final class RequestValidator {

    private final ServiceCatalog catalog;

    public RequestValidator(final ServiceCatalog catalog) {
        this.catalog = catalog;
    }

    public ServiceNamePartition partition(final List<String> names, final boolean allowBeta) {
        final List<String> known = new ArrayList<>();
        final List<String> unknown = new ArrayList<>();
        for (final String name : names) {
            final Optional<Service> service = catalog.find(name);
            if (service.isPresent() && (allowBeta || !service.get().beta())) {
                known.add(name);
            } else {
                unknown.add(name);
            }
        }
        return new ServiceNamePartition(known, unknown);
    }
}
