package org.proclient.cli.rendering;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.proclient.catalog.CatalogLoader;
import org.proclient.operation.Action;
import org.proclient.operation.ErrorEntry;
import org.proclient.operation.Message;
import org.proclient.operation.OperationResult;
import org.proclient.operation.OutputFormat;
import org.proclient.operation.Resolution;
import org.proclient.state.AttachmentState;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OperationResultRendererTest {

    private final OperationResultRenderer renderer =
        new OperationResultRenderer(CatalogLoader.loadDefault(), new ObjectMapper());
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private void render(final Action action, final OperationResult result, final OutputFormat format) {
        renderer.render(action, Resolution.unchanged(result, AttachmentState.unattached()), format,
            new PrintWriter(out), new PrintWriter(err));
    }

    @Test
    void text_printsProgressToStdoutAndErrorsToStderr() {
        final OperationResult result = new OperationResult(
            List.of("fips-updates"), List.of("cis"),
            List.of(ErrorEntry.service("cis", "service-already-enabled", "CIS Audit is already enabled.")),
            List.of(Message.DISABLING_INCOMPATIBLE_SERVICE.asServiceError("fips-updates", "Livepatch")),
            true);

        render(Action.ENABLE, result, OutputFormat.TEXT);

        assertThat(out.toString().lines()).containsExactly(
            "Disabling incompatible service: Livepatch",
            "FIPS Updates enabled",
            "A reboot is required to complete install.");
        assertThat(err.toString().trim()).isEqualTo("CIS Audit is already enabled.");
    }

    @Test
    void json_isASingleLineOnStdout() {
        render(Action.DISABLE, OperationResult.blocked(Message.UNATTACHED.asSystemError()), OutputFormat.JSON);

        assertThat(out.toString().lines()).hasSize(1);
        assertThat(out.toString()).startsWith("{\"_schema_version\":\"0.1\",\"result\":\"failure\"");
        assertThat(err.toString()).isEmpty();
    }
}
