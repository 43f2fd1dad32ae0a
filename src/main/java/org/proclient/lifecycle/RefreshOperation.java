package org.proclient.lifecycle;

import org.proclient.catalog.Service;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.contract.ContractException;
import org.proclient.contract.ContractInfo;
import org.proclient.operation.Action;
import org.proclient.operation.ErrorEntry;
import org.proclient.operation.GateVerdict;
import org.proclient.operation.Message;
import org.proclient.operation.OperationResult;
import org.proclient.operation.PreconditionGate;
import org.proclient.operation.Resolution;
import org.proclient.operation.ResultAggregator;
import org.proclient.spi.IContractClient;
import org.proclient.state.AttachmentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Re-reads the contract of an attached machine and replaces the stored entitlements.
 * <p>
 * Enabled services that lost their entitlement stay enabled but are reported as warnings.
 */
public class RefreshOperation {

    private static final Logger LOGGER = LoggerFactory.getLogger(RefreshOperation.class);

    private final ServiceCatalog catalog;
    private final IContractClient contractClient;
    private final PreconditionGate gate = new PreconditionGate();
    private final ResultAggregator aggregator = new ResultAggregator();

    public RefreshOperation(final ServiceCatalog catalog, final IContractClient contractClient) {
        this.catalog = catalog;
        this.contractClient = contractClient;
    }

    public Resolution run(final AttachmentState state, final String machineId) {
        final GateVerdict verdict = gate.evaluateSingleShot(Action.REFRESH, state);
        if (verdict.isBlocked()) {
            return Resolution.unchanged(aggregator.blocked(verdict), state);
        }

        final ContractInfo contract;
        try {
            contract = contractClient.refresh(state.machineToken(), state.contractId(), machineId);
        } catch (final ContractException e) {
            LOGGER.info("Refresh failed: {}", e.getMessage());
            return Resolution.unchanged(OperationResult.blocked(e.toErrorEntry()), state);
        }

        final List<ErrorEntry> warnings = new ArrayList<>();
        final Set<String> entitled = EntitlementMapper.entitledServices(contract, catalog, warnings);
        for (final String enabled : state.enabledServices()) {
            if (!entitled.contains(enabled)) {
                final String title = catalog.find(enabled).map(Service::title).orElse(enabled);
                warnings.add(Message.SERVICE_NO_LONGER_ENTITLED.asServiceError(enabled, title));
            }
        }

        final AttachmentState refreshed = new AttachmentState(
            true,
            entitled,
            state.enabledServices(),
            contract.machineToken(),
            contract.contractId() != null ? contract.contractId() : state.contractId(),
            contract.accountName() != null ? contract.accountName() : state.accountName(),
            contract.contractName() != null ? contract.contractName() : state.contractName());
        LOGGER.info("Refreshed contract {}: entitled to {}", refreshed.contractId(), entitled);

        final OperationResult result = new OperationResult(List.of(), List.of(), List.of(), warnings, false);
        return new Resolution(result, refreshed, !refreshed.equals(state),
            List.of("Successfully refreshed your subscription."));
    }
}
