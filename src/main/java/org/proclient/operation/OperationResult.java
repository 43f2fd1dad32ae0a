package org.proclient.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The versioned, machine-readable report of one invocation ({@code ua_operation} schema).
 * <p>
 * The overall {@link #result()} is derived: an operation fails as soon as it carries an error
 * or a failed service, so the two can never disagree.
 *
 * @param processedServices Services the action was applied to, in request order.
 * @param failedServices    Services the action failed for, in request order.
 * @param errors            Batch-level and service-level errors.
 * @param warnings          Non-fatal advisories, same shape as errors.
 * @param needsReboot       Whether any executed service requires a reboot.
 */
@JsonPropertyOrder({
    "_schema_version", "result", "processed_services", "failed_services", "errors", "warnings", "needs_reboot"
})
public record OperationResult(
    @JsonProperty("processed_services") List<String> processedServices,
    @JsonProperty("failed_services") List<String> failedServices,
    @JsonProperty("errors") List<ErrorEntry> errors,
    @JsonProperty("warnings") List<ErrorEntry> warnings,
    @JsonProperty("needs_reboot") boolean needsReboot
) {
    public static final String SCHEMA_VERSION = "0.1";

    public OperationResult {
        processedServices = List.copyOf(processedServices);
        failedServices = List.copyOf(failedServices);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);

        final Set<String> overlap = new HashSet<>(processedServices);
        overlap.retainAll(failedServices);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Services cannot be both processed and failed: " + overlap);
        }
    }

    /**
     * A failed result that never reached per-service execution.
     *
     * @param error The single batch-level error.
     * @return A failure with empty service lists.
     */
    public static OperationResult blocked(final ErrorEntry error) {
        return new OperationResult(List.of(), List.of(), List.of(error), List.of(), false);
    }

    @JsonProperty("_schema_version")
    public String schemaVersion() {
        return SCHEMA_VERSION;
    }

    @JsonProperty("result")
    public ResultStatus result() {
        return errors.isEmpty() && failedServices.isEmpty() ? ResultStatus.SUCCESS : ResultStatus.FAILURE;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return result() == ResultStatus.SUCCESS;
    }

    /**
     * Returns a copy of this result with an additional warning appended.
     *
     * @param warning The warning to append.
     * @return The new result.
     */
    public OperationResult withWarning(final ErrorEntry warning) {
        final List<ErrorEntry> extended = new ArrayList<>(warnings);
        extended.add(warning);
        return new OperationResult(processedServices, failedServices, errors, extended, needsReboot);
    }
}
