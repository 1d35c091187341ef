package de.bsommerfeld.fleetagent.updater.progress;

import de.bsommerfeld.fleetagent.updater.update.UpdateStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observable step of an update session.
 *
 * @param status        session status after the step
 * @param targetVersion version being installed, empty when not yet known
 * @param progress      0..100, or -1 for failed, cancelled and rolled back
 * @param message       human-readable description
 * @param error         failure description, empty unless unsuccessful
 * @param timestamp     when the step happened
 */
public record ProgressEvent(UpdateStatus status, String targetVersion, int progress, String message, String error,
        Instant timestamp) {

    public ProgressEvent {
        targetVersion = targetVersion == null ? "" : targetVersion;
        message = message == null ? "" : message;
        error = error == null ? "" : error;
    }

    /**
     * Wire representation sent to the fleet server. Empty target version and
     * error are omitted.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status.wireName());
        if (!targetVersion.isEmpty()) {
            data.put("target_version", targetVersion);
        }
        data.put("progress", progress);
        data.put("message", message);
        if (!error.isEmpty()) {
            data.put("error", error);
        }
        data.put("timestamp", timestamp.toString());
        return data;
    }
}
