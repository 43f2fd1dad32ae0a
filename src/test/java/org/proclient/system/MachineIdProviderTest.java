package org.proclient.system;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MachineIdProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void getMachineId_prefersTheFirstReadableSystemFile() throws Exception {
        final Path empty = Files.writeString(tempDir.resolve("etc-machine-id"), "  \n");
        final Path dbus = Files.writeString(tempDir.resolve("dbus-machine-id"), "abc123\n");

        final MachineIdProvider provider = new MachineIdProvider(List.of(empty, dbus), tempDir.resolve("data/machine-id"));

        assertThat(provider.getMachineId()).isEqualTo("abc123");
        assertThat(tempDir.resolve("data/machine-id")).doesNotExist();
    }

    @Test
    void getMachineId_generatesAndKeepsAnIdWhenTheSystemHasNone() {
        final Path fallback = tempDir.resolve("data/machine-id");
        final MachineIdProvider provider = new MachineIdProvider(List.of(tempDir.resolve("missing")), fallback);

        final String generated = provider.getMachineId();

        assertThat(generated).isNotBlank();
        assertThat(fallback).hasContent(generated);
        assertThat(new MachineIdProvider(List.of(), fallback).getMachineId()).isEqualTo(generated);
    }
}
