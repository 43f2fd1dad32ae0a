package org.proclient.system;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Provides a stable unique id for this machine.
 * <p>
 * The system ids in {@code /etc/machine-id} and {@code /var/lib/dbus/machine-id} are used when
 * present. Otherwise an id is generated once and kept in the client's data directory.
 */
public class MachineIdProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(MachineIdProvider.class);
    private static final List<Path> SYSTEM_ID_FILES = List.of(
        Path.of("/etc/machine-id"),
        Path.of("/var/lib/dbus/machine-id"));

    private final List<Path> systemIdFiles;
    private final Path fallbackFile;

    public MachineIdProvider(final Path dataDir) {
        this(SYSTEM_ID_FILES, dataDir.resolve("machine-id"));
    }

    MachineIdProvider(final List<Path> systemIdFiles, final Path fallbackFile) {
        this.systemIdFiles = List.copyOf(systemIdFiles);
        this.fallbackFile = fallbackFile;
    }

    /**
     * Returns the machine id, generating and storing one if the system has none.
     *
     * @return The machine id.
     * @throws UncheckedIOException if a generated id cannot be stored.
     */
    public String getMachineId() {
        for (final Path candidate : systemIdFiles) {
            final String id = readId(candidate);
            if (id != null) {
                return id;
            }
        }
        final String stored = readId(fallbackFile);
        if (stored != null) {
            return stored;
        }

        final String generated = UUID.randomUUID().toString();
        try {
            Files.createDirectories(fallbackFile.getParent());
            Files.writeString(fallbackFile, generated, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to store generated machine id in " + fallbackFile, e);
        }
        LOGGER.info("No system machine id found, generated {}", generated);
        return generated;
    }

    private static String readId(final Path file) {
        if (!Files.isReadable(file)) {
            return null;
        }
        try {
            final String content = Files.readString(file, StandardCharsets.UTF_8).strip();
            return content.isEmpty() ? null : content;
        } catch (final IOException e) {
            LOGGER.debug("Could not read machine id from {}: {}", file, e.getMessage());
            return null;
        }
    }
}
