package org.proclient.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.proclient.spi.IAttachmentStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Stores the attachment state as a JSON document inside the client's private data directory.
 * <p>
 * Writes go to a temporary sibling file that is then moved over the target, so a killed
 * process never leaves a half-written state file behind.
 */
public class FileAttachmentStateStore implements IAttachmentStateStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileAttachmentStateStore.class);
    static final String STATE_FILE_NAME = "attachment.json";

    private final Path stateFile;
    private final ObjectMapper mapper;

    /**
     * Creates a store rooted at the given data directory.
     *
     * @param dataDir The directory holding the state file. Created on first write.
     */
    public FileAttachmentStateStore(final Path dataDir) {
        this.stateFile = dataDir.resolve("private").resolve(STATE_FILE_NAME);
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public AttachmentState load() {
        if (!Files.exists(stateFile)) {
            LOGGER.debug("No attachment state at {}, machine is unattached.", stateFile);
            return AttachmentState.unattached();
        }
        try {
            final AttachmentState state = mapper.readValue(stateFile.toFile(), AttachmentState.class);
            LOGGER.debug("Loaded attachment state from {} (attached={}).", stateFile, state.attached());
            return state;
        } catch (final IOException e) {
            throw new StateStoreException("Failed to read attachment state from " + stateFile, e);
        }
    }

    @Override
    public void save(final AttachmentState state) {
        try {
            Files.createDirectories(stateFile.getParent());
            final Path tmp = stateFile.resolveSibling(STATE_FILE_NAME + ".tmp");
            mapper.writeValue(tmp.toFile(), state);
            restrictPermissions(tmp);
            try {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.debug("Wrote attachment state to {} (attached={}).", stateFile, state.attached());
        } catch (final IOException e) {
            throw new StateStoreException("Failed to write attachment state to " + stateFile, e);
        }
    }

    public Path getStateFile() {
        return stateFile;
    }

    // The file holds the machine token, so it is readable by root only.
    private static void restrictPermissions(final Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (final UnsupportedOperationException e) {
            LOGGER.debug("File system does not support POSIX permissions, leaving {} as is.", file);
        }
    }
}
