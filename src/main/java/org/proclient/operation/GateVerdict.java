package org.proclient.operation;

import java.util.Optional;

/**
 * Outcome of the precondition gate: either proceed, or stop with a single batch-level error.
 */
public final class GateVerdict {

    private static final GateVerdict PROCEED = new GateVerdict(null);

    private final ErrorEntry error;

    private GateVerdict(final ErrorEntry error) {
        this.error = error;
    }

    public static GateVerdict proceed() {
        return PROCEED;
    }

    public static GateVerdict blocked(final ErrorEntry error) {
        return new GateVerdict(error);
    }

    public boolean isBlocked() {
        return error != null;
    }

    public Optional<ErrorEntry> error() {
        return Optional.ofNullable(error);
    }
}
