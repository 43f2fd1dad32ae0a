package org.proclient.operation;

import java.util.List;

/**
 * Requested service names split into those the catalog knows and those it does not.
 * Both lists keep request order.
 *
 * @param known   Names found in the catalog.
 * @param unknown Names not found in the catalog.
 */
public record ServiceNamePartition(List<String> known, List<String> unknown) {
    public ServiceNamePartition {
        known = List.copyOf(known);
        unknown = List.copyOf(unknown);
    }
}
