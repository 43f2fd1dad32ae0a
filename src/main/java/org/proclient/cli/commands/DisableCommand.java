package org.proclient.cli.commands;

import org.proclient.catalog.ServiceCatalog;
import org.proclient.operation.Action;
import org.proclient.operation.EntitlementResolver;
import org.proclient.operation.InvalidRequestException;
import org.proclient.operation.OperationRequest;
import org.proclient.operation.Resolution;
import org.proclient.spi.IServiceActionHandler;
import org.proclient.state.AttachmentState;
import org.proclient.system.ReleaseInfo;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

@Command(name = "disable", description = "Disable one or more Ubuntu Pro services.")
public class DisableCommand extends AbstractOperationCommand {

    @Parameters(arity = "0..*", paramLabel = "SERVICE", description = "The services to disable.")
    List<String> services = new ArrayList<>();

    @Option(names = "--beta", description = "Allow beta services to be disabled.")
    boolean beta;

    @Override
    protected Action action() {
        return Action.DISABLE;
    }

    @Override
    protected Resolution resolve(final AttachmentState state) throws InvalidRequestException {
        final OperationRequest request = OperationRequest.of(Action.DISABLE, services, assumeYes, format, betaAllowed(beta));
        return new EntitlementResolver(registry().get(ServiceCatalog.class),
            registry().get(IServiceActionHandler.class), registry().get(ReleaseInfo.class)).resolve(request, state);
    }
}
