package org.proclient.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.cli.rendering.ServiceHelpRenderer;
import org.proclient.help.HelpNotFoundException;
import org.proclient.help.ServiceHelp;
import org.proclient.help.ServiceHelpQuery;
import org.proclient.operation.OutputFormat;
import org.proclient.system.ReleaseInfo;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Shows the description and availability of a service, or the command usage when no service
 * is named. An unknown service is an error reported on stderr only, whatever the format.
 */
@Command(name = "help", description = "Provide detailed information about Ubuntu Pro services.")
public class HelpCommand extends AbstractClientCommand {

    @Parameters(arity = "0..1", paramLabel = "SERVICE", description = "The service to describe.")
    String service;

    @Option(names = "--format", defaultValue = "text", converter = FormatConverter.class,
        description = "Output format: text or json. Default: ${DEFAULT-VALUE}")
    OutputFormat format;

    @Override
    protected int execute() {
        if (service == null) {
            spec.parent().commandLine().usage(out());
            out().flush();
            return 0;
        }

        final ServiceHelp help;
        try {
            help = new ServiceHelpQuery(registry().get(ServiceCatalog.class), registry().get(ReleaseInfo.class))
                .query(service);
        } catch (final HelpNotFoundException e) {
            err().println(e.getMessage());
            err().flush();
            return 1;
        }
        new ServiceHelpRenderer(registry().get(ObjectMapper.class)).render(help, format, out());
        out().flush();
        return 0;
    }
}
