package org.proclient.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the real entry point in a separate JVM, where Logback configures itself from the classpath.
 */
@Tag("integration")
class CommandLineInterfaceProcessTest {

    @TempDir
    Path dataDir;

    @Test
    void version_printsOnlyTheVersionOnStdout() throws Exception {
        final List<String> stdout = runPro("--version");

        assertThat(stdout).containsExactly("pro 1.0");
    }

    @Test
    void enableAsJson_keepsStdoutToAtMostOneJsonDocument() throws Exception {
        final List<String> stdout = runPro("enable", "esm-infra", "--format", "json", "--assume-yes");

        // Non-root runs print nothing on stdout; root runs print the result.
        assertThat(stdout).hasSizeLessThanOrEqualTo(1);
        for (final String line : stdout) {
            assertThat(new ObjectMapper().readTree(line).get("_schema_version").asText()).isEqualTo("0.1");
        }
    }

    private List<String> runPro(final String... args) throws IOException, InterruptedException {
        final List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add("-Dpro.data-dir=" + dataDir);
        command.add("-Dpro.reboot-required-file=" + dataDir.resolve("reboot-required"));
        command.add("-Dpro.release.version=22.04");
        command.add("-Dpro.release.series=jammy");
        command.add(CommandLineInterface.class.getName());
        command.addAll(List.of(args));

        final Process process = new ProcessBuilder(command)
            .redirectError(ProcessBuilder.Redirect.DISCARD)
            .start();
        final String stdout = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertThat(process.waitFor(30, TimeUnit.SECONDS)).isTrue();

        final List<String> lines = new ArrayList<>();
        for (final String line : stdout.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }
}
