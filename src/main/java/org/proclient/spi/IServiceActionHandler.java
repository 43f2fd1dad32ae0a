package org.proclient.spi;

import org.proclient.catalog.Service;
import org.proclient.operation.Action;
import org.proclient.operation.ExecutionContext;
import org.proclient.operation.ServiceActionOutcome;
import org.proclient.operation.ServiceExecutionException;

/**
 * Applies enable or disable to a single service.
 * <p>
 * Implementations record their effects in the {@link ExecutionContext} and must not persist
 * anything themselves; the caller writes the resulting state once the whole batch is done.
 */
public interface IServiceActionHandler {

    /**
     * Applies the action to one service.
     *
     * @param action  enable or disable.
     * @param service The catalog entry of the service.
     * @param context The working state of the batch.
     * @return What happened, including warnings and reboot requirements.
     * @throws ServiceExecutionException if the action cannot be applied to this service.
     */
    ServiceActionOutcome apply(Action action, Service service, ExecutionContext context)
        throws ServiceExecutionException;
}
