package org.proclient.contract;

/**
 * One resource entitlement granted by a contract.
 *
 * @param type            The service name the entitlement refers to.
 * @param entitled        Whether the contract actually grants it.
 * @param enableByDefault Whether the service is enabled automatically on attach.
 */
public record ContractEntitlement(String type, boolean entitled, boolean enableByDefault) {
}
