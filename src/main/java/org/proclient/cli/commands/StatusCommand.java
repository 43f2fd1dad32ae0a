package org.proclient.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.cli.rendering.StatusRenderer;
import org.proclient.operation.OutputFormat;
import org.proclient.spi.IAttachmentStateStore;
import org.proclient.status.StatusQuery;
import org.proclient.status.StatusReport;
import org.proclient.system.RebootRequiredCheck;
import org.proclient.system.ReleaseInfo;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show the attachment and service status of this machine.")
public class StatusCommand extends AbstractClientCommand {

    @Option(names = "--all", description = "Include beta services even when beta features are not allowed.")
    boolean all;

    @Option(names = "--format", defaultValue = "text", converter = FormatConverter.class,
        description = "Output format: text or json. Default: ${DEFAULT-VALUE}")
    OutputFormat format;

    @Override
    protected int execute() {
        final StatusQuery query = new StatusQuery(registry().get(ServiceCatalog.class),
            registry().get(ReleaseInfo.class), registry().get(RebootRequiredCheck.class));
        final StatusReport report = query.query(registry().get(IAttachmentStateStore.class).load(), all || betaAllowed());
        new StatusRenderer(registry().get(ObjectMapper.class)).render(report, format, out());
        out().flush();
        return 0;
    }

    private boolean betaAllowed() {
        return parent().getConfig().getBoolean("pro.features.allow_beta");
    }
}
