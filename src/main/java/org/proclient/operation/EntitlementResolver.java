package org.proclient.operation;

import org.proclient.catalog.ServiceCatalog;
import org.proclient.spi.IServiceActionHandler;
import org.proclient.state.AttachmentState;
import org.proclient.system.ReleaseInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves an enable or disable request into a single {@link OperationResult}.
 * <p>
 * The flow is: validate names against the catalog, pass the attachment gate, execute the known
 * services one by one, then aggregate. The resolver performs no I/O: the attachment state is
 * passed in and the updated state handed back, so identical inputs always yield identical
 * results.
 */
public class EntitlementResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(EntitlementResolver.class);

    private final RequestValidator validator;
    private final PreconditionGate gate;
    private final ActionExecutor executor;
    private final ResultAggregator aggregator;
    private final ReleaseInfo release;

    public EntitlementResolver(final ServiceCatalog catalog, final IServiceActionHandler handler, final ReleaseInfo release) {
        this(new RequestValidator(catalog), new PreconditionGate(), new ActionExecutor(catalog, handler),
            new ResultAggregator(), release);
    }

    EntitlementResolver(final RequestValidator validator, final PreconditionGate gate, final ActionExecutor executor,
                        final ResultAggregator aggregator, final ReleaseInfo release) {
        this.validator = validator;
        this.gate = gate;
        this.executor = executor;
        this.aggregator = aggregator;
        this.release = release;
    }

    /**
     * Resolves a batch request.
     *
     * @param request An enable or disable request.
     * @param state   The attachment state read at the start of the invocation.
     * @return The result and the state to persist.
     * @throws IllegalArgumentException if the request is not a batch action.
     */
    public Resolution resolve(final OperationRequest request, final AttachmentState state) {
        final Action action = request.action();
        if (!action.isBatch()) {
            throw new IllegalArgumentException("Cannot resolve non-batch action " + action.verb());
        }

        final ServiceNamePartition partition = validator.partition(request.requestedNames(), request.allowBeta());
        LOGGER.debug("{} requested for known={} unknown={}", action.verb(), partition.known(), partition.unknown());

        final GateVerdict verdict = gate.evaluate(action, state, partition);
        if (verdict.isBlocked()) {
            LOGGER.debug("Batch blocked before execution: {}", Classification.of(partition, state.attached()));
            return Resolution.unchanged(aggregator.blocked(verdict), state);
        }

        final ExecutionReport report = executor.execute(
            action, partition.known(), state, release, request.assumeYes());
        final OperationResult result = aggregator.executed(action, partition.unknown(), report);
        final AttachmentState finalState = report.finalState();
        return new Resolution(result, finalState, !finalState.equals(state), List.of());
    }
}
