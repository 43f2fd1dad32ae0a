package org.proclient.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty("pro.contract-url");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void load_withoutFiles_usesReferenceDefaults() {
        final Config config = ConfigLoader.load(null, tempDir.resolve("absent.conf").toFile());

        assertThat(config.getString("pro.data-dir")).isEqualTo("/var/lib/ubuntu-advantage");
        assertThat(config.getBoolean("pro.features.allow_beta")).isFalse();
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    void load_explicitFileOverridesSystemFile() throws Exception {
        final File system = Files.writeString(tempDir.resolve("pro.conf"), """
            pro.data-dir = "/srv/system"
            pro.features.allow_beta = true
            """).toFile();
        final File explicit = Files.writeString(tempDir.resolve("custom.conf"), """
            pro.data-dir = "/srv/custom"
            """).toFile();

        final Config config = ConfigLoader.load(explicit, system);

        assertThat(config.getString("pro.data-dir")).isEqualTo("/srv/custom");
        assertThat(config.getBoolean("pro.features.allow_beta")).isTrue();
    }

    @Test
    void load_systemPropertiesWin() throws Exception {
        final File explicit = Files.writeString(tempDir.resolve("custom.conf"), """
            pro.contract-url = "https://from-file"
            """).toFile();
        System.setProperty("pro.contract-url", "https://from-property");
        ConfigFactory.invalidateCaches();

        final Config config = ConfigLoader.load(explicit, tempDir.resolve("absent.conf").toFile());

        assertThat(config.getString("pro.contract-url")).isEqualTo("https://from-property");
    }

    @Test
    void load_withMissingExplicitFile_throws() {
        assertThatThrownBy(() -> ConfigLoader.load(tempDir.resolve("nope.conf").toFile()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Configuration file not found");
    }
}
