package org.proclient.cli.rendering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.proclient.catalog.Service;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.operation.Action;
import org.proclient.operation.ErrorEntry;
import org.proclient.operation.OperationResult;
import org.proclient.operation.OutputFormat;
import org.proclient.operation.Resolution;

import java.io.PrintWriter;

/**
 * Renders an {@link OperationResult} for humans or machines.
 * <p>
 * JSON goes to stdout as a single line following the {@code ua_operation} schema. Text mode
 * prints warnings, per-service progress and notices to stdout and errors to stderr.
 */
public class OperationResultRenderer {

    static final String REBOOT_REQUIRED = "A reboot is required to complete install.";

    private final ServiceCatalog catalog;
    private final ObjectMapper mapper;

    public OperationResultRenderer(final ServiceCatalog catalog, final ObjectMapper mapper) {
        this.catalog = catalog;
        this.mapper = mapper;
    }

    public void render(final Action action, final Resolution resolution, final OutputFormat format,
                       final PrintWriter out, final PrintWriter err) {
        if (format == OutputFormat.JSON) {
            renderJson(resolution.result(), out);
        } else {
            renderText(action, resolution, out, err);
        }
        out.flush();
        err.flush();
    }

    /**
     * Writes a result as JSON.
     *
     * @param result The result.
     * @param out    Where to write.
     */
    public void renderJson(final OperationResult result, final PrintWriter out) {
        try {
            out.println(mapper.writeValueAsString(result));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize operation result", e);
        }
    }

    private void renderText(final Action action, final Resolution resolution, final PrintWriter out,
                            final PrintWriter err) {
        final OperationResult result = resolution.result();
        for (final ErrorEntry warning : result.warnings()) {
            out.println(warning.message());
        }
        final String pastTense = pastTense(action);
        if (pastTense != null) {
            for (final String name : result.processedServices()) {
                out.println(title(name) + " " + pastTense);
            }
        }
        for (final String notice : resolution.notices()) {
            out.println(notice);
        }
        for (final ErrorEntry error : result.errors()) {
            err.println(error.message());
        }
        if (result.needsReboot()) {
            out.println(REBOOT_REQUIRED);
        }
    }

    private String title(final String name) {
        return catalog.find(name).map(Service::title).orElse(name);
    }

    private static String pastTense(final Action action) {
        return switch (action) {
            case ENABLE, ATTACH -> "enabled";
            case DISABLE, DETACH -> "disabled";
            case REFRESH -> null;
        };
    }
}
