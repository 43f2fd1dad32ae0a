package org.proclient.spi;

import org.proclient.contract.ContractException;
import org.proclient.contract.ContractInfo;
import org.proclient.system.ReleaseInfo;

/**
 * Talks to the contract server that issues subscriptions and their entitlements.
 */
public interface IContractClient {

    /**
     * Exchanges a contract token for a machine token and the contract's entitlements.
     *
     * @param contractToken The token the user obtained for their subscription.
     * @param machineId     The unique id of this machine.
     * @param release       The release the machine runs.
     * @return The contract as seen by this machine.
     * @throws ContractException if the token is rejected or the server cannot be reached.
     */
    ContractInfo attach(String contractToken, String machineId, ReleaseInfo release) throws ContractException;

    /**
     * Re-reads the contract of an attached machine.
     *
     * @param machineToken The machine token issued on attach.
     * @param contractId   The contract the machine is attached to.
     * @param machineId    The unique id of this machine.
     * @return The current contract.
     * @throws ContractException if the request is rejected or the server cannot be reached.
     */
    ContractInfo refresh(String machineToken, String contractId, String machineId) throws ContractException;
}
