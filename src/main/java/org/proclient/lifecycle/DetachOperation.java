package org.proclient.lifecycle;

import org.proclient.catalog.ServiceCatalog;
import org.proclient.operation.Action;
import org.proclient.operation.ActionExecutor;
import org.proclient.operation.ExecutionReport;
import org.proclient.operation.GateVerdict;
import org.proclient.operation.OperationResult;
import org.proclient.operation.PreconditionGate;
import org.proclient.operation.Resolution;
import org.proclient.operation.ResultAggregator;
import org.proclient.state.AttachmentState;
import org.proclient.system.ReleaseInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Detaches the machine from its subscription, disabling every enabled service first.
 * Dependents are disabled before the services they require.
 */
public class DetachOperation {

    private static final Logger LOGGER = LoggerFactory.getLogger(DetachOperation.class);

    private final ServiceCatalog catalog;
    private final ActionExecutor executor;
    private final PreconditionGate gate = new PreconditionGate();
    private final ResultAggregator aggregator = new ResultAggregator();
    private final ReleaseInfo release;

    public DetachOperation(final ServiceCatalog catalog, final ActionExecutor executor, final ReleaseInfo release) {
        this.catalog = catalog;
        this.executor = executor;
        this.release = release;
    }

    public Resolution run(final AttachmentState state) {
        final GateVerdict verdict = gate.evaluateSingleShot(Action.DETACH, state);
        if (verdict.isBlocked()) {
            return Resolution.unchanged(aggregator.blocked(verdict), state);
        }

        final List<String> toDisable = catalog.disableOrder(state.enabledServices());
        final ExecutionReport report = executor.execute(Action.DISABLE, toDisable, state, release, true);
        final OperationResult result = aggregator.executed(Action.DISABLE, List.of(), report);
        LOGGER.info("Detached from contract {}, disabled {}", state.contractId(), result.processedServices());

        return new Resolution(result, AttachmentState.unattached(), true, List.of("This machine is now detached."));
    }
}
