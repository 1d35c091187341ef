package de.bsommerfeld.fleetagent.updater.source;

import java.time.Instant;

/**
 * A release offered by the version source.
 */
public record VersionInfo(String version, String channel, String platform, String arch, String downloadUrl,
        String sha256, long sizeBytes, Instant publishedAt) {
}
