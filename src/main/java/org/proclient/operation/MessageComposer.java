package org.proclient.operation;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes the batch-level messages for unknown and unattached services.
 * <p>
 * Each name contributes one clause; clauses are joined with a single blank line and the
 * result never ends with one. The composition only depends on the partition and the action,
 * so it can be tested without executing anything.
 */
public final class MessageComposer {

    static final String CLAUSE_SEPARATOR = "\n\n";

    private MessageComposer() {
        // Private constructor to prevent instantiation
    }

    /**
     * Builds the error for a batch blocked because the machine is not attached.
     *
     * @param action    The requested action.
     * @param partition The known/unknown split; must contain at least one name.
     * @return A single system error covering every requested name.
     */
    public static ErrorEntry blockedUnattached(final Action action, final ServiceNamePartition partition) {
        return switch (Classification.of(partition, false)) {
            case ALL_UNKNOWN -> unknownServices(action, partition.unknown());
            case ALL_KNOWN_UNATTACHED -> ErrorEntry.system(
                Message.VALID_SERVICE_FAILURE_UNATTACHED.code(), unattachedClauses(partition.known()));
            case MIXED_UNATTACHED -> Message.MIXED_SERVICES_FAILURE_UNATTACHED.asSystemError(
                unknownClauses(action, partition.unknown()), unattachedClauses(partition.known()));
            case ATTACHED_EXECUTION -> throw new IllegalStateException("Unattached batch cannot be classified as attached");
        };
    }

    /**
     * Builds the error reporting names the catalog does not know.
     *
     * @param action  The requested action.
     * @param unknown The unknown names in request order; must not be empty.
     * @return A single system error with one clause per name.
     */
    public static ErrorEntry unknownServices(final Action action, final List<String> unknown) {
        if (unknown.isEmpty()) {
            throw new IllegalArgumentException("No unknown services to report");
        }
        return ErrorEntry.system(Message.INVALID_SERVICE_OR_FAILURE.code(), unknownClauses(action, unknown));
    }

    private static String unknownClauses(final Action action, final List<String> names) {
        final List<String> clauses = new ArrayList<>(names.size());
        for (final String name : names) {
            clauses.add(Message.INVALID_SERVICE_OR_FAILURE.format(action.verb(), name));
        }
        return String.join(CLAUSE_SEPARATOR, clauses);
    }

    private static String unattachedClauses(final List<String> names) {
        final List<String> clauses = new ArrayList<>(names.size());
        for (final String name : names) {
            clauses.add(Message.VALID_SERVICE_FAILURE_UNATTACHED.format(name));
        }
        return String.join(CLAUSE_SEPARATOR, clauses);
    }
}
