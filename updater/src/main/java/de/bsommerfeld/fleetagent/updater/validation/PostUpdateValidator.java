package de.bsommerfeld.fleetagent.updater.validation;

import de.bsommerfeld.fleetagent.updater.marker.RollbackMarker;
import de.bsommerfeld.fleetagent.updater.marker.RollbackMarkerStore;
import de.bsommerfeld.fleetagent.updater.update.PostUpdateResult;
import de.bsommerfeld.fleetagent.updater.update.UpdateErrorCode;
import de.bsommerfeld.fleetagent.updater.update.UpdateStatus;
import de.bsommerfeld.fleetagent.updater.version.VersionEligibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Decides on process start whether the last self-initiated update took.
 *
 * <p>
 * The running version is compared with the marker: the expected version
 * plus a healthy probe is a success, the previous version means the
 * installer or service manager rolled back, anything else is a failure.
 * Every outcome clears the marker. Failed outcomes exclude the expected
 * version through the {@link FailedVersionRegistry}.
 */
public class PostUpdateValidator {

    private static final Logger LOG = LoggerFactory.getLogger(PostUpdateValidator.class);

    private final RollbackMarkerStore markerStore;
    private final FailedVersionRegistry failedVersions;
    private final HealthProbe healthProbe;

    public PostUpdateValidator(RollbackMarkerStore markerStore, FailedVersionRegistry failedVersions,
            HealthProbe healthProbe) {
        this.markerStore = markerStore;
        this.failedVersions = failedVersions;
        this.healthProbe = healthProbe;
    }

    /**
     * @throws IOException if a marker exists but is unreadable
     */
    public Optional<RollbackMarker> pendingMarker() throws IOException {
        return markerStore.read();
    }

    public PostUpdateResult validate(RollbackMarker marker, String runningVersion) {
        String previous = marker.previousVersion() == null ? "" : marker.previousVersion();
        String expected = marker.expectedNewVersion();
        PostUpdateResult result;

        if (VersionEligibility.sameVersion(runningVersion, expected)) {
            Optional<String> unhealthy = probe();
            if (unhealthy.isPresent()) {
                result = PostUpdateResult.failed(UpdateStatus.FAILED, previous, expected,
                        UpdateErrorCode.HEALTH_CHECK, "Health check failed after update: " + unhealthy.get());
            } else {
                result = PostUpdateResult.succeeded(previous, expected);
            }
        } else if (!previous.isEmpty() && VersionEligibility.sameVersion(runningVersion, previous)) {
            result = PostUpdateResult.failed(UpdateStatus.ROLLED_BACK, previous, expected,
                    UpdateErrorCode.ROLLED_BACK,
                    "Update to " + expected + " was rolled back, still running " + runningVersion);
        } else {
            result = PostUpdateResult.failed(UpdateStatus.FAILED, previous, expected,
                    UpdateErrorCode.VERSION_MISMATCH,
                    "Expected version " + expected + " after update but running " + runningVersion);
        }

        if (result.isSuccess()) {
            failedVersions.clear(expected);
            LOG.info("Update {} -> {} validated", previous, expected);
        } else {
            failedVersions.recordFailure(expected);
            LOG.error("Post-update validation failed: {}", result.error());
        }
        clearMarker();
        return result;
    }

    /**
     * Handles a marker that exists but cannot be parsed. It is removed; no
     * version is excluded since none is known.
     */
    public PostUpdateResult discardCorrupt(IOException cause) {
        LOG.error("Discarding unreadable rollback marker {}", markerStore.file(), cause);
        clearMarker();
        return PostUpdateResult.failed(UpdateStatus.FAILED, "", "", UpdateErrorCode.MARKER_CORRUPT,
                "Rollback marker unreadable: " + cause.getMessage());
    }

    private Optional<String> probe() {
        try {
            return healthProbe.check();
        } catch (RuntimeException e) {
            return Optional.of(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void clearMarker() {
        try {
            markerStore.clear();
        } catch (IOException e) {
            // A marker that stays behind is validated again on the next start
            LOG.error("Failed to clear rollback marker {}", markerStore.file(), e);
        }
    }
}
