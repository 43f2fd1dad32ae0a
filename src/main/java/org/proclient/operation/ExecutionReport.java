package org.proclient.operation;

import org.proclient.state.AttachmentState;

import java.util.List;

/**
 * Everything the executor learned while running a batch.
 *
 * @param outcomes    One outcome per executed service, in execution order.
 * @param errors      Service-scoped errors of the failed services.
 * @param warnings    Advisories collected from every step.
 * @param needsReboot Whether any executed service requires a reboot.
 * @param finalState  The attachment state after applying every successful step.
 */
public record ExecutionReport(
    List<ServiceOutcome> outcomes,
    List<ErrorEntry> errors,
    List<ErrorEntry> warnings,
    boolean needsReboot,
    AttachmentState finalState
) {
    public ExecutionReport {
        outcomes = List.copyOf(outcomes);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
