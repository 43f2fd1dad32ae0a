package org.proclient.cli.rendering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.proclient.help.ServiceHelp;
import org.proclient.operation.OutputFormat;

import java.io.PrintWriter;

/**
 * Renders {@link ServiceHelp} as a labeled text block or as JSON.
 */
public class ServiceHelpRenderer {

    private final ObjectMapper mapper;

    public ServiceHelpRenderer(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void render(final ServiceHelp help, final OutputFormat format, final PrintWriter out) {
        if (format == OutputFormat.JSON) {
            try {
                out.println(mapper.writeValueAsString(help));
            } catch (final JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize help for " + help.name(), e);
            }
        } else {
            out.println("Name:");
            out.println(help.name());
            out.println();
            out.println("Available:");
            out.println(help.available());
            out.println();
            out.println("Help:");
            out.println(help.help());
        }
        out.flush();
    }
}
