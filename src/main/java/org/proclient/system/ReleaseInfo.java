package org.proclient.system;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The release the client runs on, as read from {@code /etc/os-release}.
 *
 * @param version The numeric release, e.g. "22.04".
 * @param series  The lower-case series codename, e.g. "jammy".
 */
public record ReleaseInfo(String version, String series) {

    // Matches VERSION values such as "22.04.3 LTS (Jammy Jellyfish)" once point releases are stripped.
    private static final Pattern VERSION_PATTERN = Pattern.compile("(?<release>\\d+\\.\\d+) (LTS )?\\((?<series>\\w+).*");
    private static final Pattern LTS_POINT_RELEASE = Pattern.compile("\\.\\d LTS");

    public ReleaseInfo {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(series, "series");
    }

    /**
     * Derives the release from parsed os-release fields.
     * <p>
     * {@code VERSION_ID} and {@code VERSION_CODENAME} are preferred; older releases only carry
     * the combined {@code VERSION} field, which is parsed as a fallback.
     *
     * @param osRelease The key/value pairs of the os-release file.
     * @return The release.
     * @throws IllegalArgumentException if neither form is present or parseable.
     */
    public static ReleaseInfo fromOsRelease(final Map<String, String> osRelease) {
        final String versionId = osRelease.get("VERSION_ID");
        final String codename = osRelease.get("VERSION_CODENAME");
        if (versionId != null && codename != null && !codename.isBlank()) {
            return new ReleaseInfo(versionId, codename.toLowerCase());
        }

        final String version = osRelease.get("VERSION");
        if (version == null) {
            throw new IllegalArgumentException("os-release has neither VERSION_CODENAME nor VERSION");
        }
        final String normalized = LTS_POINT_RELEASE.matcher(version).replaceAll(" LTS");
        final Matcher matcher = VERSION_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                "Could not parse os-release VERSION: " + version + " (modified to " + normalized + ")");
        }
        return new ReleaseInfo(matcher.group("release"), matcher.group("series").toLowerCase());
    }

    /**
     * Formats the release the way messages refer to it.
     *
     * @return e.g. "22.04 (jammy)".
     */
    public String displayName() {
        return version + " (" + series + ")";
    }
}
