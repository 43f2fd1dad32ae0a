package org.proclient.system;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ReleaseInfoTest {

    @TempDir
    Path tempDir;

    @Test
    void fromOsRelease_readsAnOsReleaseFile() throws Exception {
        final Path file = tempDir.resolve("os-release");
        Files.writeString(file, """
            PRETTY_NAME="Ubuntu 22.04.3 LTS"
            NAME="Ubuntu"
            # comment
            VERSION_ID="22.04"
            VERSION="22.04.3 LTS (Jammy Jellyfish)"
            VERSION_CODENAME=jammy
            EMPTY=

            """);

        final Map<String, String> fields = OsReleaseReader.read(file);
        final ReleaseInfo release = ReleaseInfo.fromOsRelease(fields);

        assertThat(fields).containsEntry("NAME", "Ubuntu").doesNotContainKey("EMPTY");
        assertThat(release).isEqualTo(new ReleaseInfo("22.04", "jammy"));
        assertThat(release.displayName()).isEqualTo("22.04 (jammy)");
    }

    @Test
    void fromOsRelease_fallsBackToTheVersionField() {
        final ReleaseInfo release = ReleaseInfo.fromOsRelease(Map.of("VERSION", "16.04.7 LTS (Xenial Xerus)"));

        assertThat(release).isEqualTo(new ReleaseInfo("16.04", "xenial"));
    }

    @Test
    void fromOsRelease_rejectsUnparseableVersions() {
        assertThatThrownBy(() -> ReleaseInfo.fromOsRelease(Map.of("VERSION", "rolling")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReleaseInfo.fromOsRelease(Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
