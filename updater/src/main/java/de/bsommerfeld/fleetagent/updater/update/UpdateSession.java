package de.bsommerfeld.fleetagent.updater.update;

import java.time.Instant;
import java.util.UUID;

/**
 * The live update run. Owned by {@link UpdateManager}; every field except
 * {@link #cancelRequested} is read and written under the manager's lock.
 */
final class UpdateSession {

    final String runId = UUID.randomUUID().toString();
    final Instant startedAt;
    final boolean forced;
    final String reason;

    UpdateStatus status;
    String targetVersion = "";
    int progress;
    String message = "";

    private volatile boolean cancelRequested;

    UpdateSession(UpdateStatus status, Instant startedAt, boolean forced, String reason) {
        this.status = status;
        this.startedAt = startedAt;
        this.forced = forced;
        this.reason = reason == null ? "" : reason;
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    void requestCancel() {
        cancelRequested = true;
    }

    boolean isCancellable() {
        return status.isCancellable() && !cancelRequested;
    }
}
