package org.proclient.contract;

import java.util.List;

/**
 * What the contract server reports for an attached machine.
 *
 * @param machineToken The token the machine uses to authenticate later requests.
 * @param contractId   The contract identifier.
 * @param contractName The contract display name.
 * @param accountName  The account display name.
 * @param entitlements The resource entitlements of the contract.
 */
public record ContractInfo(
    String machineToken,
    String contractId,
    String contractName,
    String accountName,
    List<ContractEntitlement> entitlements
) {
    public ContractInfo {
        entitlements = List.copyOf(entitlements);
    }
}
