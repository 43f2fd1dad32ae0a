package org.proclient.cli.commands;

import org.proclient.catalog.ServiceCatalog;
import org.proclient.lifecycle.RefreshOperation;
import org.proclient.operation.Action;
import org.proclient.operation.Resolution;
import org.proclient.spi.IContractClient;
import org.proclient.state.AttachmentState;
import org.proclient.system.MachineIdProvider;
import picocli.CommandLine.Command;

@Command(name = "refresh", description = "Refresh the contract and entitlements of this machine.")
public class RefreshCommand extends AbstractOperationCommand {

    @Override
    protected Action action() {
        return Action.REFRESH;
    }

    @Override
    protected Resolution resolve(final AttachmentState state) {
        return new RefreshOperation(registry().get(ServiceCatalog.class), registry().get(IContractClient.class))
            .run(state, registry().get(MachineIdProvider.class).getMachineId());
    }
}
