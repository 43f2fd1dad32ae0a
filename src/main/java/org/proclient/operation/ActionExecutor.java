package org.proclient.operation;

import org.proclient.catalog.ServiceCatalog;
import org.proclient.spi.IServiceActionHandler;
import org.proclient.state.AttachmentState;
import org.proclient.system.ReleaseInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies an action to each eligible service, strictly sequentially and in request order.
 * <p>
 * Services are independent: a failure is recorded against that service and the next one is
 * still attempted. The outcome list mirrors the input order, which callers rely on.
 */
public class ActionExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActionExecutor.class);

    private final ServiceCatalog catalog;
    private final IServiceActionHandler handler;

    public ActionExecutor(final ServiceCatalog catalog, final IServiceActionHandler handler) {
        this.catalog = catalog;
        this.handler = handler;
    }

    /**
     * Runs the action for every given service.
     *
     * @param action    enable or disable.
     * @param services  Known service names in the order they should be attempted.
     * @param state     The attachment state at the start of the batch.
     * @param release   The release the machine runs.
     * @param assumeYes Whether dependency changes may be applied without asking.
     * @return The collected outcomes and the resulting state.
     */
    public ExecutionReport execute(final Action action, final List<String> services, final AttachmentState state,
                                   final ReleaseInfo release, final boolean assumeYes) {
        final ExecutionContext context = new ExecutionContext(state, release, assumeYes);
        final List<ServiceOutcome> outcomes = new ArrayList<>(services.size());
        final List<ErrorEntry> errors = new ArrayList<>();
        final List<ErrorEntry> warnings = new ArrayList<>();
        boolean needsReboot = false;

        for (final String name : services) {
            final ExecutionContext.Checkpoint checkpoint = context.checkpoint();
            try {
                final ServiceActionOutcome outcome = handler.apply(action, catalog.get(name), context);
                warnings.addAll(outcome.warnings());
                needsReboot |= outcome.needsReboot();
                outcomes.add(new ServiceOutcome(name, outcome.skipped() ? OutcomeStatus.SKIPPED : OutcomeStatus.SUCCESS));
                LOGGER.debug("{} {}: {}", action.verb(), name, outcome.skipped() ? "skipped" : "done");
            } catch (final ServiceExecutionException e) {
                context.rollback(checkpoint);
                errors.add(e.toErrorEntry());
                outcomes.add(new ServiceOutcome(name, OutcomeStatus.FAILURE));
                LOGGER.info("Failed to {} {}: [{}] {}", action.verb(), name, e.getMessageCode(), e.getMessage());
            }
        }
        return new ExecutionReport(outcomes, errors, warnings, needsReboot, context.toState());
    }
}
