package org.proclient.catalog;

import java.util.List;
import java.util.Map;

/**
 * An optional, subscription-gated host service as described by the catalog.
 *
 * @param name                 The unique key used on the command line (e.g. "esm-infra").
 * @param title                The human-readable title (e.g. "Ubuntu Pro: ESM Infra").
 * @param description          A one-line description shown by {@code pro status}.
 * @param helpText             The long help text shown by {@code pro help <name>}.
 * @param availableByRelease   Release series mapped to availability. Series not listed are unavailable.
 * @param beta                 Whether the service is hidden unless beta services are allowed.
 * @param requiredServices     Services that must be enabled before this one.
 * @param incompatibleServices Services that cannot be enabled alongside this one.
 * @param rebootOnEnable       Whether enabling the service requires a reboot.
 */
public record Service(
    String name,
    String title,
    String description,
    String helpText,
    Map<String, Boolean> availableByRelease,
    boolean beta,
    List<String> requiredServices,
    List<String> incompatibleServices,
    boolean rebootOnEnable
) {
    public Service {
        availableByRelease = Map.copyOf(availableByRelease);
        requiredServices = List.copyOf(requiredServices);
        incompatibleServices = List.copyOf(incompatibleServices);
    }

    /**
     * Checks whether this service can be used on the given release series.
     *
     * @param series The release series codename, e.g. "jammy".
     * @return true if the catalog marks the series as available.
     */
    public boolean isAvailableOn(final String series) {
        return series != null && availableByRelease.getOrDefault(series, false);
    }
}
