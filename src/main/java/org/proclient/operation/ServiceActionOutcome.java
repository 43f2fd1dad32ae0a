package org.proclient.operation;

import java.util.List;

/**
 * What a handler reports after successfully applying an action to one service.
 *
 * @param skipped     true if the service had already reached the target state earlier in the batch.
 * @param needsReboot true if a reboot is required to complete the action.
 * @param warnings    Advisories raised while applying the action, e.g. dependencies changed along the way.
 */
public record ServiceActionOutcome(boolean skipped, boolean needsReboot, List<ErrorEntry> warnings) {
    public ServiceActionOutcome {
        warnings = List.copyOf(warnings);
    }

    public static ServiceActionOutcome skippedOutcome() {
        return new ServiceActionOutcome(true, false, List.of());
    }
}
