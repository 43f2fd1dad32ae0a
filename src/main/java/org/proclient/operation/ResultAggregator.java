package org.proclient.operation;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges validator, gate and executor outcomes into one {@link OperationResult}.
 */
public final class ResultAggregator {

    /**
     * Builds the result of a batch the gate refused.
     *
     * @param verdict A blocked verdict.
     * @return A failure with a single batch-level error and no service outcomes.
     */
    public OperationResult blocked(final GateVerdict verdict) {
        final ErrorEntry error = verdict.error()
            .orElseThrow(() -> new IllegalArgumentException("Verdict is not blocked"));
        return OperationResult.blocked(error);
    }

    /**
     * Builds the result of an executed batch.
     * <p>
     * Unknown names are reported first as one batch-level error, followed by the service
     * errors in execution order. Skipped services reached their target state earlier in the
     * batch and count as processed.
     *
     * @param action  The executed action.
     * @param unknown Requested names the catalog does not know, in request order.
     * @param report  The executor's report.
     * @return The aggregated result.
     */
    public OperationResult executed(final Action action, final List<String> unknown, final ExecutionReport report) {
        final List<String> processed = new ArrayList<>();
        final List<String> failed = new ArrayList<>();
        for (final ServiceOutcome outcome : report.outcomes()) {
            if (outcome.status() == OutcomeStatus.FAILURE) {
                failed.add(outcome.serviceName());
            } else {
                processed.add(outcome.serviceName());
            }
        }

        final List<ErrorEntry> errors = new ArrayList<>();
        if (!unknown.isEmpty()) {
            errors.add(MessageComposer.unknownServices(action, unknown));
        }
        errors.addAll(report.errors());

        return new OperationResult(processed, failed, errors, report.warnings(), report.needsReboot());
    }
}
