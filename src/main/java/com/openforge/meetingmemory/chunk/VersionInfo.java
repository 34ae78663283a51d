package com.openforge.meetingmemory.chunk;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Version metadata for a chunk that describes one revision of a named artifact.
 *
 * @param artifact        what is being versioned ("schema", "pricing deck"); never blank
 * @param version         the version label as spoken ("v2", "2.1"); may be blank when unknown
 * @param previousVersion the version this one replaces, when mentioned
 * @param changes         what changed relative to the previous version
 */
public record VersionInfo(
        String       artifact,
        String       version,
        @Nullable String previousVersion,
        List<String> changes
) {

    public VersionInfo {
        if (artifact == null || artifact.isBlank()) {
            throw new IllegalArgumentException("version info requires a non-blank artifact");
        }
        artifact = artifact.trim();
        version  = version == null ? "" : version.trim();
        changes  = changes == null ? List.of() : List.copyOf(changes);
    }

    public static VersionInfo of(String artifact, String version) {
        return new VersionInfo(artifact, version, null, List.of());
    }

    /** Identity used for grouping chunks into a chain: trimmed, lower-cased artifact name. */
    public String normalizedArtifact() {
        return artifact.toLowerCase(Locale.ROOT);
    }
}
