package org.proclient.lifecycle;

import org.proclient.catalog.Service;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.contract.ContractEntitlement;
import org.proclient.contract.ContractException;
import org.proclient.contract.ContractInfo;
import org.proclient.operation.Action;
import org.proclient.operation.ActionExecutor;
import org.proclient.operation.ErrorEntry;
import org.proclient.operation.ExecutionReport;
import org.proclient.operation.GateVerdict;
import org.proclient.operation.OperationResult;
import org.proclient.operation.PreconditionGate;
import org.proclient.operation.Resolution;
import org.proclient.operation.ResultAggregator;
import org.proclient.spi.IContractClient;
import org.proclient.state.AttachmentState;
import org.proclient.system.ReleaseInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Attaches the machine to a subscription with a contract token.
 * <p>
 * On success the machine becomes attached with the contract's entitlements, and the services
 * the contract enables by default are enabled through the regular executor. A default service
 * that fails to enable does not undo the attachment; it shows up as a failed service.
 */
public class AttachOperation {

    private static final Logger LOGGER = LoggerFactory.getLogger(AttachOperation.class);

    private final ServiceCatalog catalog;
    private final IContractClient contractClient;
    private final ActionExecutor executor;
    private final PreconditionGate gate = new PreconditionGate();
    private final ResultAggregator aggregator = new ResultAggregator();
    private final ReleaseInfo release;

    public AttachOperation(final ServiceCatalog catalog, final IContractClient contractClient,
                           final ActionExecutor executor, final ReleaseInfo release) {
        this.catalog = catalog;
        this.contractClient = contractClient;
        this.executor = executor;
        this.release = release;
    }

    /**
     * Runs the attach.
     *
     * @param token      The contract token.
     * @param autoEnable Whether services enabled by default should be enabled.
     * @param state      The attachment state read at the start of the invocation.
     * @param machineId  The unique id of this machine.
     * @return The result and the state to persist.
     */
    public Resolution run(final String token, final boolean autoEnable, final AttachmentState state,
                          final String machineId) {
        final GateVerdict verdict = gate.evaluateSingleShot(Action.ATTACH, state);
        if (verdict.isBlocked()) {
            return Resolution.unchanged(aggregator.blocked(verdict), state);
        }

        final ContractInfo contract;
        try {
            contract = contractClient.attach(token, machineId, release);
        } catch (final ContractException e) {
            LOGGER.info("Attach failed: {}", e.getMessage());
            return Resolution.unchanged(OperationResult.blocked(e.toErrorEntry()), state);
        }

        final List<ErrorEntry> warnings = new ArrayList<>();
        final Set<String> entitled = EntitlementMapper.entitledServices(contract, catalog, warnings);
        final AttachmentState attached = new AttachmentState(true, entitled, Set.of(), contract.machineToken(),
            contract.contractId(), contract.accountName(), contract.contractName());
        LOGGER.info("Attached to contract {} of account {}", contract.contractId(), contract.accountName());

        OperationResult result = new OperationResult(List.of(), List.of(), List.of(), List.of(), false);
        AttachmentState finalState = attached;
        final List<String> defaults = autoEnable ? defaultServices(contract, entitled) : List.of();
        if (!defaults.isEmpty()) {
            final ExecutionReport report = executor.execute(Action.ENABLE, defaults, attached, release, true);
            result = aggregator.executed(Action.ENABLE, List.of(), report);
            finalState = report.finalState();
        }
        for (final ErrorEntry warning : warnings) {
            result = result.withWarning(warning);
        }

        final String account = contract.accountName() != null ? contract.accountName() : contract.contractName();
        return new Resolution(result, finalState, true,
            List.of("This machine is now attached to '" + account + "'"));
    }

    private List<String> defaultServices(final ContractInfo contract, final Set<String> entitled) {
        final Set<String> defaults = new LinkedHashSet<>();
        for (final ContractEntitlement entitlement : contract.entitlements()) {
            if (!entitlement.enableByDefault() || !entitled.contains(entitlement.type())) {
                continue;
            }
            final Service service = catalog.get(entitlement.type());
            if (service.beta() || !service.isAvailableOn(release.series())) {
                LOGGER.debug("Not enabling {} by default on {}", service.name(), release.series());
                continue;
            }
            defaults.add(service.name());
        }
        return catalog.enableOrder(defaults);
    }
}
