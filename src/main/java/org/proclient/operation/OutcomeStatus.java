package org.proclient.operation;

/**
 * Per-service result of an executed action.
 */
public enum OutcomeStatus {
    /** The action was applied. */
    SUCCESS,
    /** The action was attempted and failed. */
    FAILURE,
    /** The service already reached the target state earlier in the same batch. */
    SKIPPED
}
