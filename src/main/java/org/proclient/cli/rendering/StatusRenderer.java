package org.proclient.cli.rendering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.proclient.operation.Message;
import org.proclient.operation.OutputFormat;
import org.proclient.status.ServiceStatusEntry;
import org.proclient.status.StatusReport;

import java.io.PrintWriter;

/**
 * Renders a {@link StatusReport} as a service table or as JSON.
 */
public class StatusRenderer {

    private static final String ATTACHED_ROW = "%-17s%-10s%-10s%s%n";
    private static final String UNATTACHED_ROW = "%-17s%-11s%s%n";

    private final ObjectMapper mapper;

    public StatusRenderer(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void render(final StatusReport report, final OutputFormat format, final PrintWriter out) {
        if (format == OutputFormat.JSON) {
            try {
                out.println(mapper.writeValueAsString(report));
            } catch (final JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize status", e);
            }
            out.flush();
            return;
        }

        if (report.attached()) {
            out.printf(ATTACHED_ROW, "SERVICE", "ENTITLED", "STATUS", "DESCRIPTION");
            for (final ServiceStatusEntry entry : report.services()) {
                out.printf(ATTACHED_ROW, entry.name(), entry.entitled(), entry.status(), entry.description());
            }
            out.println();
            if (report.account() != null) {
                out.println("Account: " + report.account());
            }
            if (report.contract() != null) {
                out.println("Subscription: " + report.contract());
            }
        } else {
            out.printf(UNATTACHED_ROW, "SERVICE", "AVAILABLE", "DESCRIPTION");
            for (final ServiceStatusEntry entry : report.services()) {
                out.printf(UNATTACHED_ROW, entry.name(), entry.available(), entry.description());
            }
            out.println();
            out.println(Message.UNATTACHED.format());
        }
        if (report.rebootRequired()) {
            out.println("System reboot required");
        }
        out.flush();
    }
}
