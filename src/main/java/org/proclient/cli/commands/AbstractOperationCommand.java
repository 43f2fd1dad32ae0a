package org.proclient.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.cli.rendering.OperationResultRenderer;
import org.proclient.operation.Action;
import org.proclient.operation.ActionExecutor;
import org.proclient.operation.InvalidRequestException;
import org.proclient.operation.Message;
import org.proclient.operation.OperationResult;
import org.proclient.operation.OutputFormat;
import org.proclient.operation.Resolution;
import org.proclient.spi.IAttachmentStateStore;
import org.proclient.spi.IServiceActionHandler;
import org.proclient.state.AttachmentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

/**
 * Template for the commands that change the machine: read the state once, resolve, write the
 * state once if it changed, render the result.
 */
abstract class AbstractOperationCommand extends AbstractClientCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractOperationCommand.class);

    @Option(names = {"-y", "--assume-yes"}, description = "Do not prompt for confirmation before performing the action.")
    boolean assumeYes;

    @Option(
        names = "--format",
        defaultValue = "text",
        converter = FormatConverter.class,
        description = "Output format: text or json (json requires --assume-yes). Default: ${DEFAULT-VALUE}"
    )
    OutputFormat format;

    @Override
    protected final int execute() {
        final Action action = action();
        final OperationResultRenderer renderer = new OperationResultRenderer(
            registry().get(ServiceCatalog.class), registry().get(ObjectMapper.class));

        if (format == OutputFormat.JSON && !assumeYes) {
            renderer.renderJson(OperationResult.blocked(Message.JSON_FORMAT_REQUIRE_ASSUME_YES.asSystemError()), out());
            out().flush();
            return 1;
        }

        final IAttachmentStateStore store = registry().get(IAttachmentStateStore.class);
        final AttachmentState state = store.load();

        Resolution resolution;
        try {
            resolution = resolve(state);
        } catch (final InvalidRequestException e) {
            LOGGER.debug("Rejected {} request: {}", action.verb(), e.getMessage());
            resolution = Resolution.unchanged(OperationResult.blocked(e.toErrorEntry()), state);
        }

        if (resolution.changed()) {
            store.save(resolution.state());
        }
        renderer.render(action, resolution, format, out(), err());
        return resolution.result().isSuccess() ? 0 : 1;
    }

    protected abstract Action action();

    /**
     * Computes the outcome of the command against the current state.
     *
     * @param state The attachment state read at the start of the invocation.
     * @return The result and the state to persist.
     * @throws InvalidRequestException if the command line does not form a valid request.
     */
    protected abstract Resolution resolve(AttachmentState state) throws InvalidRequestException;

    protected ActionExecutor executor() {
        return new ActionExecutor(registry().get(ServiceCatalog.class), registry().get(IServiceActionHandler.class));
    }

    protected boolean betaAllowed(final boolean betaFlag) {
        return betaFlag || parent().getConfig().getBoolean("pro.features.allow_beta");
    }
}
