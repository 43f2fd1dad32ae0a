package org.proclient.system;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the {@code KEY=value} pairs of an os-release file.
 */
public final class OsReleaseReader {

    private OsReleaseReader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Parses an os-release file. Blank lines, comments and empty values are ignored; values
     * are stripped of surrounding quotes.
     *
     * @param file Usually {@code /etc/os-release}.
     * @return The parsed fields in file order.
     * @throws IOException if the file cannot be read.
     */
    public static Map<String, String> read(final Path file) throws IOException {
        final Map<String, String> data = new LinkedHashMap<>();
        for (final String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            final String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            final int separator = trimmed.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            final String value = trimmed.substring(separator + 1).trim();
            if (!value.isEmpty()) {
                data.put(trimmed.substring(0, separator), stripQuotes(value));
            }
        }
        return data;
    }

    private static String stripQuotes(final String value) {
        if (value.length() >= 2
                && (value.startsWith("\"") && value.endsWith("\"") || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
