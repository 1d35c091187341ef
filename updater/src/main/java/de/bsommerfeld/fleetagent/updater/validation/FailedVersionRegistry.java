package de.bsommerfeld.fleetagent.updater.validation;

import com.fasterxml.jackson.core.type.TypeReference;
import de.bsommerfeld.fleetagent.updater.util.JsonSupport;
import de.bsommerfeld.fleetagent.updater.version.SemanticVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Versions whose post-update validation failed, with the time of failure.
 * A recorded version is not offered again by scheduled or commanded checks
 * until its cool-down has passed. Other versions are unaffected.
 *
 * <p>
 * Entries survive restarts in a JSON file. When the file cannot be written
 * the registry keeps working in memory.
 */
public class FailedVersionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FailedVersionRegistry.class);
    private static final TypeReference<TreeMap<String, Instant>> TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, Instant> failures;

    public FailedVersionRegistry(Path file, Duration cooldown, Clock clock) {
        this.file = file;
        this.cooldown = cooldown;
        this.clock = clock;
        this.failures = load(file);
        pruneExpired();
    }

    public synchronized void recordFailure(String version) {
        String key = key(version);
        if (key.isEmpty()) {
            return;
        }
        failures.put(key, clock.instant());
        LOG.warn("Version {} excluded from updates for {} hours", key, cooldown.toHours());
        pruneExpired();
        persist();
    }

    public synchronized boolean isExcluded(String version) {
        Instant failedAt = failures.get(key(version));
        return failedAt != null && clock.instant().isBefore(failedAt.plus(cooldown));
    }

    /** @return when the exclusion of {@code version} ends, or null if none */
    public synchronized Instant excludedUntil(String version) {
        Instant failedAt = failures.get(key(version));
        return failedAt == null ? null : failedAt.plus(cooldown);
    }

    public synchronized void clear(String version) {
        if (failures.remove(key(version)) != null) {
            persist();
        }
    }

    private void pruneExpired() {
        Instant now = clock.instant();
        failures.values().removeIf(failedAt -> !now.isBefore(failedAt.plus(cooldown)));
    }

    private void persist() {
        try {
            JsonSupport.writeDurably(file, failures);
        } catch (IOException e) {
            LOG.error("Failed to persist failed-version registry {}", file, e);
        }
    }

    private static Map<String, Instant> load(Path file) {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            Map<String, Instant> stored = JsonSupport.mapper().readValue(file.toFile(), TYPE);
            return stored == null ? new TreeMap<>() : stored;
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable failed-version registry {}: {}", file, e.getMessage());
            return new TreeMap<>();
        }
    }

    private static String key(String version) {
        return SemanticVersion.normalize(version);
    }
}
