package org.proclient.cli.commands;

import org.proclient.catalog.ServiceCatalog;
import org.proclient.lifecycle.DetachOperation;
import org.proclient.operation.Action;
import org.proclient.operation.Resolution;
import org.proclient.state.AttachmentState;
import org.proclient.system.ReleaseInfo;
import picocli.CommandLine.Command;

@Command(name = "detach", description = "Remove this machine from an Ubuntu Pro subscription.")
public class DetachCommand extends AbstractOperationCommand {

    @Override
    protected Action action() {
        return Action.DETACH;
    }

    @Override
    protected Resolution resolve(final AttachmentState state) {
        return new DetachOperation(registry().get(ServiceCatalog.class), executor(), registry().get(ReleaseInfo.class))
            .run(state);
    }
}
