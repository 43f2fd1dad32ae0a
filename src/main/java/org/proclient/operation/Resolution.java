package org.proclient.operation;

import org.proclient.state.AttachmentState;

import java.util.List;
import java.util.Objects;

/**
 * The result of an operation together with the attachment state it leaves behind.
 *
 * @param result  The report shown to the user.
 * @param state   The attachment state after the operation.
 * @param changed Whether {@code state} differs from the state the operation started with
 *                and therefore has to be persisted.
 * @param notices Extra human-readable lines for text output only, e.g. the attached account.
 */
public record Resolution(OperationResult result, AttachmentState state, boolean changed, List<String> notices) {
    public Resolution {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(state, "state");
        notices = List.copyOf(notices);
    }

    /**
     * A resolution that leaves the state untouched.
     *
     * @param result The report.
     * @param state  The unchanged state.
     * @return The resolution.
     */
    public static Resolution unchanged(final OperationResult result, final AttachmentState state) {
        return new Resolution(result, state, false, List.of());
    }
}
