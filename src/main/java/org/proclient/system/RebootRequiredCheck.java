package org.proclient.system;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks whether the package manager has asked for a reboot.
 */
public class RebootRequiredCheck {

    private final Path markerFile;

    /**
     * @param markerFile Usually {@code /var/run/reboot-required}.
     */
    public RebootRequiredCheck(final Path markerFile) {
        this.markerFile = markerFile;
    }

    public boolean isRebootRequired() {
        return Files.exists(markerFile);
    }
}
