package org.proclient.cli.commands;

import org.proclient.catalog.ServiceCatalog;
import org.proclient.lifecycle.AttachOperation;
import org.proclient.operation.Action;
import org.proclient.operation.Resolution;
import org.proclient.spi.IContractClient;
import org.proclient.state.AttachmentState;
import org.proclient.system.MachineIdProvider;
import org.proclient.system.ReleaseInfo;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "attach", description = "Attach this machine to an Ubuntu Pro subscription.")
public class AttachCommand extends AbstractOperationCommand {

    @Parameters(index = "0", paramLabel = "TOKEN", description = "Token obtained for Ubuntu Pro authentication.")
    String token;

    @Option(names = "--no-auto-enable", description = "Do not enable any recommended services automatically.")
    boolean noAutoEnable;

    @Override
    protected Action action() {
        return Action.ATTACH;
    }

    @Override
    protected Resolution resolve(final AttachmentState state) {
        final AttachOperation operation = new AttachOperation(registry().get(ServiceCatalog.class),
            registry().get(IContractClient.class), executor(), registry().get(ReleaseInfo.class));
        return operation.run(token, !noAutoEnable, state, registry().get(MachineIdProvider.class).getMachineId());
    }
}
