package de.bsommerfeld.fleetagent.updater.update;

import de.bsommerfeld.fleetagent.updater.policy.PolicySource;

import java.time.Instant;

/**
 * Read-only snapshot of the update manager for status pages and the server.
 * Instants are {@code null} when unknown.
 *
 * <p>
 * {@code status} is {@link UpdateStatus#CANCELLED} from the moment a cancel is
 * accepted until the cancelled run reaches its next checkpoint. The manager
 * only accepts new requests once it reads {@link UpdateStatus#IDLE} again.
 */
public record ManagerStatus(
        boolean enabled,
        String disabledReason,
        String currentVersion,
        String latestVersion,
        boolean updateAvailable,
        UpdateStatus status,
        int progress,
        String message,
        Instant lastCheckAt,
        Instant nextCheckAt,
        PolicySource policySource,
        int checkIntervalDays,
        String channel,
        String platform,
        String arch) {
}
