package org.proclient.state;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FileAttachmentStateStoreTest {

    @TempDir
    Path dataDir;

    @Test
    void load_withoutStateFile_returnsUnattached() {
        final FileAttachmentStateStore store = new FileAttachmentStateStore(dataDir);

        assertThat(store.load()).isEqualTo(AttachmentState.unattached());
    }

    @Test
    void save_thenLoad_returnsTheSameState() throws Exception {
        final FileAttachmentStateStore store = new FileAttachmentStateStore(dataDir);
        final AttachmentState state = new AttachmentState(
            true, Set.of("esm-infra", "livepatch"), Set.of("esm-infra"), "secret", "cid", "Acme", "Acme Pro");

        store.save(state);

        assertThat(store.getStateFile()).isEqualTo(dataDir.resolve("private").resolve("attachment.json"));
        assertThat(Files.readString(store.getStateFile()))
            .contains("\"enabled_services\"")
            .contains("\"machine_token\" : \"secret\"");
        assertThat(new FileAttachmentStateStore(dataDir).load()).isEqualTo(state);
        assertThat(dataDir.resolve("private").resolve("attachment.json.tmp")).doesNotExist();
    }

    @Test
    void load_toleratesMissingOptionalFields() throws Exception {
        final Path file = dataDir.resolve("private").resolve("attachment.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"attached\": true, \"entitlements\": [\"cis\"]}");

        final AttachmentState state = new FileAttachmentStateStore(dataDir).load();

        assertThat(state.attached()).isTrue();
        assertThat(state.isEntitledTo("cis")).isTrue();
        assertThat(state.enabledServices()).isEmpty();
        assertThat(state.machineToken()).isNull();
    }

    @Test
    void load_withCorruptFile_throwsStateStoreException() throws Exception {
        final Path file = dataDir.resolve("private").resolve("attachment.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new FileAttachmentStateStore(dataDir).load())
            .isInstanceOf(StateStoreException.class)
            .hasMessageContaining("Failed to read attachment state");
    }
}
