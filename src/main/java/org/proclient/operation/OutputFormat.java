package org.proclient.operation;

import java.util.Locale;

/**
 * How a result is rendered on the console.
 */
public enum OutputFormat {
    TEXT,
    JSON;

    /**
     * Parses a format name case-insensitively.
     *
     * @param value "text" or "json".
     * @return The matching format.
     * @throws IllegalArgumentException if the value names no format.
     */
    public static OutputFormat parse(final String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid format '" + value + "', expected one of: text, json", e);
        }
    }
}
