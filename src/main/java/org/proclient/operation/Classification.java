package org.proclient.operation;

/**
 * The mutually exclusive shapes a batch request can take once validated and gated.
 */
public enum Classification {
    /** No requested name is in the catalog. */
    ALL_UNKNOWN,
    /** Every name is known, but the machine is not attached. */
    ALL_KNOWN_UNATTACHED,
    /** Known and unknown names, and the machine is not attached. */
    MIXED_UNATTACHED,
    /** The machine is attached; known names are executed, unknown ones reported. */
    ATTACHED_EXECUTION;

    /**
     * Classifies a partitioned request.
     *
     * @param partition The known/unknown split.
     * @param attached  Whether the machine is attached.
     * @return The classification.
     */
    public static Classification of(final ServiceNamePartition partition, final boolean attached) {
        if (partition.known().isEmpty()) {
            return ALL_UNKNOWN;
        }
        if (attached) {
            return ATTACHED_EXECUTION;
        }
        return partition.unknown().isEmpty() ? ALL_KNOWN_UNATTACHED : MIXED_UNATTACHED;
    }
}
