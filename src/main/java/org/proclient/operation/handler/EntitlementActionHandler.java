package org.proclient.operation.handler;

import org.proclient.catalog.Service;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.operation.Action;
import org.proclient.operation.ErrorEntry;
import org.proclient.operation.ExecutionContext;
import org.proclient.operation.Message;
import org.proclient.operation.ServiceActionOutcome;
import org.proclient.operation.ServiceExecutionException;
import org.proclient.spi.IServiceActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Enables and disables services by checking entitlement, release availability and the
 * dependency rules declared in the catalog.
 * <p>
 * Enabling a service first stops its incompatible services and starts its required ones;
 * disabling first stops the services that depend on it. Those side effects need
 * {@code --assume-yes}; without it the service fails with a message naming the blocker.
 * Package installation itself is outside the client's scope; the effect of a successful
 * action is the updated set of enabled services.
 */
public class EntitlementActionHandler implements IServiceActionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(EntitlementActionHandler.class);

    private final ServiceCatalog catalog;

    public EntitlementActionHandler(final ServiceCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public ServiceActionOutcome apply(final Action action, final Service service, final ExecutionContext context)
            throws ServiceExecutionException {
        return switch (action) {
            case ENABLE -> enable(service, context);
            case DISABLE -> disable(service, context);
            default -> throw new IllegalArgumentException("Unsupported per-service action: " + action.verb());
        };
    }

    private ServiceActionOutcome enable(final Service service, final ExecutionContext context)
            throws ServiceExecutionException {
        final String name = service.name();
        if (context.isEnabled(name)) {
            if (context.wasChangedInBatch(name)) {
                return ServiceActionOutcome.skippedOutcome();
            }
            throw new ServiceExecutionException(name, Message.SERVICE_ALREADY_ENABLED, service.title());
        }
        if (!context.isEntitledTo(name)) {
            throw new ServiceExecutionException(name, Message.SUBSCRIPTION_NOT_ENTITLED_TO_SERVICE, service.title());
        }
        if (!service.isAvailableOn(context.release().series())) {
            throw new ServiceExecutionException(
                name, Message.INAPPLICABLE_RELEASE_SERIES, service.title(), context.release().displayName());
        }

        final List<ErrorEntry> warnings = new ArrayList<>();
        boolean needsReboot = service.rebootOnEnable();

        for (final String incompatibleName : service.incompatibleServices()) {
            if (!context.isEnabled(incompatibleName)) {
                continue;
            }
            final Service incompatible = catalog.get(incompatibleName);
            if (!context.assumeYes()) {
                throw new ServiceExecutionException(
                    name, Message.INCOMPATIBLE_SERVICE_STOPPED_ENABLE, service.title(), incompatible.title());
            }
            try {
                warnings.addAll(disable(incompatible, context).warnings());
            } catch (final ServiceExecutionException e) {
                throw new ServiceExecutionException(name, e);
            }
            warnings.add(Message.DISABLING_INCOMPATIBLE_SERVICE.asServiceError(name, incompatible.title()));
        }

        for (final String requiredName : service.requiredServices()) {
            if (context.isEnabled(requiredName)) {
                continue;
            }
            final Service required = catalog.get(requiredName);
            if (!context.assumeYes()) {
                throw new ServiceExecutionException(
                    name, Message.REQUIRED_SERVICE_STOPPED_ENABLE, service.title(), required.title());
            }
            try {
                final ServiceActionOutcome requiredOutcome = enable(required, context);
                warnings.addAll(requiredOutcome.warnings());
                needsReboot |= requiredOutcome.needsReboot();
            } catch (final ServiceExecutionException e) {
                throw new ServiceExecutionException(name, e);
            }
            warnings.add(Message.ENABLING_REQUIRED_SERVICE.asServiceError(name, required.title()));
        }

        context.markEnabled(name);
        LOGGER.debug("Enabled {}", name);
        return new ServiceActionOutcome(false, needsReboot, warnings);
    }

    private ServiceActionOutcome disable(final Service service, final ExecutionContext context)
            throws ServiceExecutionException {
        final String name = service.name();
        if (!context.isEnabled(name)) {
            if (context.wasChangedInBatch(name)) {
                return ServiceActionOutcome.skippedOutcome();
            }
            throw new ServiceExecutionException(name, Message.SERVICE_ALREADY_DISABLED, service.title());
        }

        final List<ErrorEntry> warnings = new ArrayList<>();
        for (final Service dependent : catalog.dependentsOf(name)) {
            if (!context.isEnabled(dependent.name())) {
                continue;
            }
            if (!context.assumeYes()) {
                throw new ServiceExecutionException(
                    name, Message.DEPENDENT_SERVICE_STOPPED_DISABLE, service.title(), dependent.title());
            }
            warnings.addAll(disable(dependent, context).warnings());
            warnings.add(Message.DISABLING_DEPENDENT_SERVICE.asServiceError(name, dependent.title()));
        }

        context.markDisabled(name);
        LOGGER.debug("Disabled {}", name);
        return new ServiceActionOutcome(false, false, warnings);
    }
}
