package org.proclient.operation;

/**
 * The outcome of applying an action to one service.
 *
 * @param serviceName The service the action was applied to.
 * @param status      What happened.
 */
public record ServiceOutcome(String serviceName, OutcomeStatus status) {
}
