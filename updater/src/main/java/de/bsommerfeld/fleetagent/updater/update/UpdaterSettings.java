package de.bsommerfeld.fleetagent.updater.update;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Static settings of the update manager, fixed for the life of the process.
 *
 * @param agentId          identity reported in telemetry
 * @param currentVersion   version of the running binary
 * @param channel          release channel asked for, e.g. {@code stable}
 * @param platform         operating system, e.g. {@code linux}
 * @param arch             CPU architecture, e.g. {@code amd64}
 * @param workDir          directory holding downloads, marker and registry
 * @param minDiskSpaceMb   free space required before a download starts
 * @param policyRecheck    how often the loop re-reads policy when idle
 * @param shutdownGrace    how long {@code stop} waits for an install to end
 */
public record UpdaterSettings(String agentId, String currentVersion, String channel, String platform, String arch,
        Path workDir, long minDiskSpaceMb, Duration policyRecheck, Duration shutdownGrace) {

    public UpdaterSettings {
        channel = channel == null || channel.isBlank() ? "stable" : channel.trim();
        minDiskSpaceMb = minDiskSpaceMb <= 0 ? 200 : minDiskSpaceMb;
        policyRecheck = policyRecheck == null || policyRecheck.isZero() || policyRecheck.isNegative()
                ? Duration.ofHours(1)
                : policyRecheck;
        shutdownGrace = shutdownGrace == null || shutdownGrace.isNegative() ? Duration.ofSeconds(30) : shutdownGrace;
    }

    public Path downloadDir() {
        return workDir.resolve("downloads");
    }
}
