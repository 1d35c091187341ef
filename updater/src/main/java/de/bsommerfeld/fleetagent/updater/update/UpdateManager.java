package de.bsommerfeld.fleetagent.updater.update;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.fleetagent.updater.marker.RollbackMarker;
import de.bsommerfeld.fleetagent.updater.marker.RollbackMarkerStore;
import de.bsommerfeld.fleetagent.updater.policy.EffectivePolicy;
import de.bsommerfeld.fleetagent.updater.policy.PolicyProvider;
import de.bsommerfeld.fleetagent.updater.policy.PolicySpec;
import de.bsommerfeld.fleetagent.updater.progress.ProgressEvent;
import de.bsommerfeld.fleetagent.updater.progress.ProgressSink;
import de.bsommerfeld.fleetagent.updater.source.ArtifactHandle;
import de.bsommerfeld.fleetagent.updater.source.RestartTrigger;
import de.bsommerfeld.fleetagent.updater.source.VersionInfo;
import de.bsommerfeld.fleetagent.updater.source.VersionSource;
import de.bsommerfeld.fleetagent.updater.telemetry.TelemetryPayload;
import de.bsommerfeld.fleetagent.updater.telemetry.TelemetryReporter;
import de.bsommerfeld.fleetagent.updater.util.ByteFormatter;
import de.bsommerfeld.fleetagent.updater.validation.FailedVersionRegistry;
import de.bsommerfeld.fleetagent.updater.validation.PostUpdateValidator;
import de.bsommerfeld.fleetagent.updater.version.VersionEligibility;
import de.bsommerfeld.fleetagent.updater.version.VersionEligibility.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orchestrates the agent's self-update: check, download, verify, install,
 * restart and, on the next start, validation.
 *
 * <p>
 * At most one session is live. Requests that arrive while one is live fail
 * fast with {@link UpdateBusyException}. Every state change emits exactly one
 * {@link ProgressEvent}; a session's progress never decreases and drops to -1
 * when it fails, is cancelled or rolled back.
 *
 * <h3>Locking</h3>
 * A read/write lock guards the session and the policy snapshot. Transitions
 * and event emission happen under the write lock so observers see them in
 * order. Network, disk and installer work runs without the lock.
 */
@Singleton
public class UpdateManager {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateManager.class);

    static final int PROGRESS_CHECKING = 0;
    static final int PROGRESS_AVAILABLE = 5;
    static final int PROGRESS_DOWNLOAD_START = 10;
    static final int PROGRESS_DOWNLOAD_END = 70;
    static final int PROGRESS_VERIFYING = 75;
    static final int PROGRESS_INSTALLING = 85;
    static final int PROGRESS_AWAITING_RESTART = 95;
    static final int PROGRESS_VALIDATING = 95;
    static final int PROGRESS_DONE = 100;

    private static final Duration MIN_RESCHEDULE = Duration.ofSeconds(1);

    private final UpdaterSettings settings;
    private final PolicyProvider policyProvider;
    private final VersionSource versionSource;
    private final RestartTrigger restartTrigger;
    private final ProgressSink progressSink;
    private final RollbackMarkerStore markerStore;
    private final FailedVersionRegistry failedVersions;
    private final PostUpdateValidator validator;
    private final TelemetryReporter telemetry;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Condition sessionChanged = lock.writeLock().newCondition();

    // Guarded by lock
    private UpdateSession session;
    private EffectivePolicy policy;
    private String latestVersion = "";
    private Instant lastCheckAt;
    private Instant nextCheckAt;
    private Duration jitter = Duration.ZERO;

    private ScheduledExecutorService scheduler;
    private volatile boolean stopping;

    @Inject
    public UpdateManager(UpdaterSettings settings, PolicyProvider policyProvider, VersionSource versionSource,
            RestartTrigger restartTrigger, ProgressSink progressSink, RollbackMarkerStore markerStore,
            FailedVersionRegistry failedVersions, PostUpdateValidator validator, TelemetryReporter telemetry,
            Clock clock) {
        this.settings = settings;
        this.policyProvider = policyProvider;
        this.versionSource = versionSource;
        this.restartTrigger = restartTrigger;
        this.progressSink = progressSink;
        this.markerStore = markerStore;
        this.failedVersions = failedVersions;
        this.validator = validator;
        this.telemetry = telemetry;
        this.clock = clock;
        this.policy = policyProvider.effectivePolicy();
    }

    // -- lifecycle --

    /**
     * Validates a pending update, then starts the periodic check loop.
     */
    public void start() {
        LOG.info("Starting update manager (version {}, channel {}, {}/{})", settings.currentVersion(),
                settings.channel(), settings.platform(), settings.arch());
        try {
            PostUpdateResult result = validatePostUpdate();
            if (result.updated()) {
                LOG.info("Post-update validation finished: {}", result.status().wireName());
            }
        } catch (UpdateBusyException e) {
            LOG.warn("Skipping post-update validation: {}", e.getMessage());
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("update-scheduler-%d")
                .setDaemon(true)
                .build());
        lock.writeLock().lock();
        try {
            jitter = randomJitter(policy);
        } finally {
            lock.writeLock().unlock();
        }
        scheduleCycle(Duration.ZERO);
    }

    /**
     * Stops the check loop. A cancellable session is cancelled; an install
     * in progress is given up to {@code grace} to complete.
     */
    public void stop(Duration grace) {
        stopping = true;
        if (cancel()) {
            LOG.info("Cancelled running update for shutdown");
        }

        lock.writeLock().lock();
        try {
            long remaining = grace.toNanos();
            while (session != null && session.status == UpdateStatus.INSTALLING && remaining > 0) {
                remaining = sessionChanged.awaitNanos(remaining);
            }
            if (session != null && session.status == UpdateStatus.INSTALLING) {
                LOG.warn("Install still running after {} s shutdown grace", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.writeLock().unlock();
        }

        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
        }
        telemetry.close();
    }

    public void stop() {
        stop(settings.shutdownGrace());
    }

    // -- commands --

    /**
     * Runs one check and, when an eligible version is offered, installs it.
     *
     * @return the status the session ended in; {@link UpdateStatus#AWAITING_RESTART}
     *         once the new version is installed and a restart was requested or
     *         declined
     * @throws UpdateBusyException     if a session is already live
     * @throws UpdateDisabledException if auto-update is disabled locally
     */
    public UpdateStatus checkNow() throws UpdateException {
        EffectivePolicy current = policyProvider.effectivePolicy();
        UpdateSession s = openSession(current, false, "");
        return runSession(s, current);
    }

    /**
     * Installs the latest release regardless of pin strategy, major-version
     * gating, failed-version exclusion, or whether it is already installed.
     * Refused when auto-update is disabled locally.
     *
     * @param reason free text carried into logs, marker and telemetry
     */
    public UpdateStatus forceInstallLatest(String reason) throws UpdateException {
        EffectivePolicy current = policyProvider.effectivePolicy();
        UpdateSession s = openSession(current, true, reason);
        LOG.info("Forced update requested: {}", s.reason.isEmpty() ? "(no reason)" : s.reason);
        return runSession(s, current);
    }

    /**
     * Cancels the live session if it is checking, downloading or verifying.
     * The session reports {@link UpdateStatus#CANCELLED} immediately; its
     * worker stops at the next checkpoint and releases the session. Until
     * then the cancelled session is still live, so new requests fail with
     * {@link UpdateBusyException}.
     *
     * @return whether a session was cancelled
     */
    public boolean cancel() {
        lock.writeLock().lock();
        try {
            if (session == null || !session.isCancellable()) {
                return false;
            }
            UpdateSession s = session;
            s.requestCancel();
            s.status = UpdateStatus.CANCELLED;
            s.progress = -1;
            s.message = "Update cancelled";
            emit(s, "");
            report(s, null, "");
            LOG.info("Update run {} cancelled", s.runId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Checks whether this start follows a self-initiated update and whether
     * that update took. Emits nothing when there is no rollback marker.
     *
     * @throws UpdateBusyException if a session is already live
     */
    public PostUpdateResult validatePostUpdate() throws UpdateBusyException {
        RollbackMarker marker;
        try {
            Optional<RollbackMarker> pending = validator.pendingMarker();
            if (pending.isEmpty()) {
                return PostUpdateResult.notUpdated();
            }
            marker = pending.get();
        } catch (IOException e) {
            UpdateSession s = openValidationSession("", "");
            PostUpdateResult result = validator.discardCorrupt(e);
            finish(s, result.status(), result.error(), result.errorCode(), result.error());
            return result;
        }

        UpdateSession s = openValidationSession(marker.expectedNewVersion(), marker.reason());
        PostUpdateResult result = validator.validate(marker, settings.currentVersion());
        String message = result.isSuccess()
                ? "Updated to " + result.toVersion()
                : result.error();
        finish(s, result.status(), message, result.errorCode(), result.error());
        return result;
    }

    /**
     * Snapshot for status pages. Never waits on a running download.
     */
    public ManagerStatus status() {
        lock.readLock().lock();
        try {
            PolicySpec spec = policy.spec();
            boolean available = spec != null && !latestVersion.isEmpty()
                    && VersionEligibility.evaluate(settings.currentVersion(), latestVersion, spec).eligible();
            return new ManagerStatus(
                    policy.isEnabled(),
                    policy.isEnabled() ? policy.blocked().orElse("") : "Auto-update disabled by local policy",
                    settings.currentVersion(),
                    latestVersion,
                    available,
                    session == null ? UpdateStatus.IDLE : session.status,
                    session == null ? 0 : session.progress,
                    session == null ? "" : session.message,
                    lastCheckAt,
                    nextCheckAt,
                    policy.source(),
                    spec == null ? 0 : spec.updateCheckDays(),
                    settings.channel(),
                    settings.platform(),
                    settings.arch());
        } finally {
            lock.readLock().unlock();
        }
    }

    // -- session flow --

    private UpdateStatus runSession(UpdateSession s, EffectivePolicy current) throws UpdateException {
        ArtifactHandle artifact = null;
        try {
            Optional<String> blocked = current.blocked();
            if (!s.forced && blocked.isPresent()) {
                LOG.warn("No update is eligible: {}", blocked.get());
                return finish(s, UpdateStatus.UP_TO_DATE, "No eligible update: " + blocked.get(), null, "");
            }

            VersionInfo latest = versionSource.checkLatest(settings.channel(), settings.platform(), settings.arch());
            recordCheck(latest);
            if (latest == null || latest.version() == null || latest.version().isBlank()) {
                throw new UpdateException(UpdateErrorCode.SERVER_ERROR, "Server offered no release");
            }

            if (!s.forced) {
                Decision decision = decide(latest.version(), current.spec());
                if (!decision.eligible()) {
                    LOG.info("No update: {}", decision.reason());
                    return finish(s, UpdateStatus.UP_TO_DATE, decision.reason(), null, "");
                }
            }

            if (!transition(s, UpdateStatus.AVAILABLE, PROGRESS_AVAILABLE, latest.version(),
                    "Update available: " + latest.version())) {
                return releaseCancelled(s);
            }
            checkDiskSpace(latest.sizeBytes());

            if (!transition(s, UpdateStatus.DOWNLOADING, PROGRESS_DOWNLOAD_START, null,
                    "Downloading " + latest.version())) {
                return releaseCancelled(s);
            }
            long expected = latest.sizeBytes();
            artifact = versionSource.download(latest,
                    (read, total) -> onDownloadProgress(s, read, total > 0 ? total : expected),
                    s::isCancelRequested);

            if (!transition(s, UpdateStatus.VERIFYING, PROGRESS_VERIFYING, null,
                    "Verifying " + ByteFormatter.format(artifact.bytes()))) {
                deleteArtifact(artifact);
                return releaseCancelled(s);
            }
            versionSource.verify(artifact);

            // Last cancellation checkpoint: once installing, the run completes
            if (!transition(s, UpdateStatus.INSTALLING, PROGRESS_INSTALLING, null,
                    "Installing " + latest.version())) {
                deleteArtifact(artifact);
                return releaseCancelled(s);
            }
            install(s, artifact);
            artifact = null;

            transition(s, UpdateStatus.AWAITING_RESTART, PROGRESS_AWAITING_RESTART, null,
                    "Restarting into " + latest.version());
            report(s, null, "");
            return restart(s);
        } catch (UpdateException e) {
            deleteArtifact(artifact);
            if (s.isCancelRequested()) {
                return releaseCancelled(s);
            }
            LOG.error("Update run {} failed [{}]: {}", s.runId, e.getCode(), e.getMessage());
            return finish(s, UpdateStatus.FAILED, e.getMessage(), e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            deleteArtifact(artifact);
            LOG.error("Update run {} failed unexpectedly", s.runId, e);
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            return finish(s, UpdateStatus.FAILED, "Update failed", UpdateErrorCode.INTERNAL, error);
        }
    }

    private Decision decide(String candidate, PolicySpec spec) {
        Decision decision = VersionEligibility.evaluate(settings.currentVersion(), candidate, spec);
        if (decision.eligible() && failedVersions.isExcluded(candidate)) {
            return new Decision(false, "Version " + candidate + " failed validation recently, excluded until "
                    + failedVersions.excludedUntil(candidate));
        }
        return decision;
    }

    private void install(UpdateSession s, ArtifactHandle artifact) throws UpdateException {
        RollbackMarker marker = new RollbackMarker(settings.currentVersion(), artifact.info().version(),
                clock.instant(), s.runId, s.reason);
        try {
            markerStore.write(marker);
        } catch (IOException e) {
            throw new UpdateException(UpdateErrorCode.INSTALL_FAILED, "Cannot write rollback marker", e);
        }

        try {
            versionSource.install(artifact);
        } catch (UpdateException | RuntimeException e) {
            // Nothing was replaced, so there is nothing to validate on the next start
            try {
                markerStore.clear();
            } catch (IOException clearFailure) {
                e.addSuppressed(clearFailure);
            }
            throw e;
        }
    }

    private UpdateStatus restart(UpdateSession s) {
        try {
            if (!restartTrigger.restart()) {
                // Still running the old process; the marker is validated on whatever start comes next
                LOG.info("No restart after update run {}; new version applies on next start", s.runId);
                releaseAwaitingRestart(s);
            }
            return UpdateStatus.AWAITING_RESTART;
        } catch (UpdateException e) {
            // The new binary is in place; the marker stays so a manual restart is still validated
            LOG.error("Restart after update failed: {}", e.getMessage());
            return finish(s, UpdateStatus.FAILED, "Installed but restart failed: " + e.getMessage(),
                    UpdateErrorCode.RESTART_FAILED, e.getMessage());
        }
    }

    private void checkDiskSpace(long artifactBytes) throws UpdateException {
        // Room for the download, a staged copy and the backup of the old binary
        long required = Math.max(artifactBytes * 3, ByteFormatter.megabytes(settings.minDiskSpaceMb()));
        try {
            Path dir = settings.downloadDir();
            Files.createDirectories(dir);
            long usable = Files.getFileStore(dir).getUsableSpace();
            if (usable < required) {
                throw new UpdateException(UpdateErrorCode.DISK_SPACE, "Insufficient disk space: need "
                        + ByteFormatter.format(required) + ", have " + ByteFormatter.format(usable));
            }
        } catch (IOException e) {
            LOG.warn("Could not determine free disk space: {}", e.getMessage());
        }
    }

    private void onDownloadProgress(UpdateSession s, long read, long total) {
        if (total <= 0) {
            return;
        }
        int span = PROGRESS_DOWNLOAD_END - PROGRESS_DOWNLOAD_START;
        int pct = PROGRESS_DOWNLOAD_START + (int) Math.min(span, span * read / total);
        lock.writeLock().lock();
        try {
            if (session != s || s.status != UpdateStatus.DOWNLOADING || pct <= s.progress) {
                return;
            }
            s.progress = pct;
            s.message = "Downloaded " + ByteFormatter.format(read) + " of " + ByteFormatter.format(total);
            emit(s, "");
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -- session bookkeeping --

    private UpdateSession openSession(EffectivePolicy current, boolean forced, String reason)
            throws UpdateException {
        lock.writeLock().lock();
        try {
            policy = current;
            if (session != null) {
                throw new UpdateBusyException(session.status);
            }
            if (!current.isEnabled()) {
                String message = forced
                        ? "Forced update refused: auto-update disabled by local policy"
                        : "Auto-update disabled by local policy";
                progressSink.publish(new ProgressEvent(UpdateStatus.FAILED, "", -1, message, message,
                        clock.instant()));
                throw new UpdateDisabledException(message);
            }
            UpdateSession s = new UpdateSession(UpdateStatus.CHECKING, clock.instant(), forced, reason);
            s.progress = PROGRESS_CHECKING;
            s.message = forced ? "Checking for latest release (forced)" : "Checking for updates";
            session = s;
            emit(s, "");
            return s;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private UpdateSession openValidationSession(String targetVersion, String reason) throws UpdateBusyException {
        lock.writeLock().lock();
        try {
            if (session != null) {
                throw new UpdateBusyException(session.status);
            }
            UpdateSession s = new UpdateSession(UpdateStatus.VALIDATING, clock.instant(), false, reason);
            s.targetVersion = targetVersion;
            s.progress = PROGRESS_VALIDATING;
            s.message = "Validating update";
            session = s;
            emit(s, "");
            return s;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves a live session forward.
     *
     * @return false if the session was cancelled meanwhile
     */
    private boolean transition(UpdateSession s, UpdateStatus next, int progress, String targetVersion,
            String message) {
        lock.writeLock().lock();
        try {
            if (session != s || s.isCancelRequested()) {
                return false;
            }
            s.status = next;
            s.progress = Math.max(s.progress, progress);
            if (targetVersion != null) {
                s.targetVersion = targetVersion;
            }
            s.message = message;
            emit(s, "");
            sessionChanged.signalAll();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Ends a session in a terminal status and returns the manager to idle.
     */
    private UpdateStatus finish(UpdateSession s, UpdateStatus terminal, String message, UpdateErrorCode code,
            String error) {
        lock.writeLock().lock();
        try {
            if (session != s) {
                return terminal;
            }
            if (s.isCancelRequested()) {
                release(s);
                return UpdateStatus.CANCELLED;
            }
            s.status = terminal;
            s.progress = terminal.isUnsuccessful() ? -1 : PROGRESS_DONE;
            s.message = message;
            emit(s, error);
            if (terminal != UpdateStatus.UP_TO_DATE) {
                report(s, code, error);
            }
            release(s);
            return terminal;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private UpdateStatus releaseCancelled(UpdateSession s) {
        lock.writeLock().lock();
        try {
            release(s);
            LOG.debug("Update run {} released after cancellation", s.runId);
            return UpdateStatus.CANCELLED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void releaseAwaitingRestart(UpdateSession s) {
        lock.writeLock().lock();
        try {
            release(s);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock
    private void release(UpdateSession s) {
        if (session == s) {
            session = null;
            sessionChanged.signalAll();
        }
    }

    // Caller holds the write lock
    private void emit(UpdateSession s, String error) {
        progressSink.publish(new ProgressEvent(s.status, s.targetVersion, s.progress, s.message, error,
                clock.instant()));
    }

    // Caller holds the write lock
    private void report(UpdateSession s, UpdateErrorCode code, String error) {
        PolicySpec spec = policy.spec();
        if (spec == null || !spec.collectTelemetry()) {
            return;
        }
        telemetry.submit(new TelemetryPayload(settings.agentId(), s.runId, s.status.wireName(),
                settings.currentVersion(), s.targetVersion, code == null ? "" : code.name(), error, s.reason,
                clock.instant()));
    }

    private void recordCheck(VersionInfo latest) {
        lock.writeLock().lock();
        try {
            lastCheckAt = clock.instant();
            latestVersion = latest == null || latest.version() == null ? "" : latest.version();
            jitter = randomJitter(policy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void deleteArtifact(ArtifactHandle artifact) {
        if (artifact == null) {
            return;
        }
        try {
            Files.deleteIfExists(artifact.file());
        } catch (IOException e) {
            LOG.warn("Failed to remove artifact {}: {}", artifact.file(), e.getMessage());
        }
    }

    // -- scheduling --

    /**
     * One wake-up of the periodic loop: re-reads the policy and runs a check
     * when one is due and the maintenance window allows it.
     */
    void runScheduledCycle() {
        EffectivePolicy current = policyProvider.effectivePolicy();
        Instant now = clock.instant();
        Instant due;

        lock.writeLock().lock();
        try {
            policy = current;
            if (!current.isEnabled() || !current.spec().automaticChecksEnabled()) {
                nextCheckAt = null;
                return;
            }
            Duration interval = Duration.ofDays(current.spec().updateCheckDays());
            due = lastCheckAt == null ? now : lastCheckAt.plus(interval).plus(jitter);
            nextCheckAt = due;
        } finally {
            lock.writeLock().unlock();
        }

        if (now.isBefore(due)) {
            return;
        }
        if (!current.spec().maintenanceWindow().allows(now)) {
            LOG.debug("Update check due but outside maintenance window");
            return;
        }

        try {
            UpdateStatus result = checkNow();
            LOG.info("Scheduled update check finished: {}", result.wireName());
        } catch (UpdateBusyException e) {
            LOG.debug("Scheduled update check skipped: {}", e.getMessage());
        } catch (UpdateException e) {
            LOG.warn("Scheduled update check not run: {}", e.getMessage());
        }

        lock.writeLock().lock();
        try {
            if (lastCheckAt != null && policy.spec() != null) {
                nextCheckAt = lastCheckAt.plus(Duration.ofDays(policy.spec().updateCheckDays())).plus(jitter);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void scheduleCycle(Duration delay) {
        if (stopping || scheduler == null) {
            return;
        }
        try {
            scheduler.schedule(() -> {
                try {
                    runScheduledCycle();
                } catch (Exception e) {
                    LOG.error("Update check cycle failed", e);
                }
                scheduleCycle(nextDelay());
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Update scheduler already stopped");
        }
    }

    private Duration nextDelay() {
        Duration recheck = settings.policyRecheck();
        lock.readLock().lock();
        try {
            if (nextCheckAt == null) {
                return recheck;
            }
            Duration untilDue = Duration.between(clock.instant(), nextCheckAt);
            if (untilDue.compareTo(MIN_RESCHEDULE) < 0) {
                // Due but blocked (maintenance window, busy); look again later
                return recheck;
            }
            return untilDue.compareTo(recheck) < 0 ? untilDue : recheck;
        } finally {
            lock.readLock().unlock();
        }
    }

    // Up to 10% of the interval, so a fleet does not check in lockstep
    private static Duration randomJitter(EffectivePolicy current) {
        PolicySpec spec = current.spec();
        if (spec == null || !spec.automaticChecksEnabled()) {
            return Duration.ZERO;
        }
        long tenth = Duration.ofDays(spec.updateCheckDays()).toMillis() / 10;
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(tenth + 1));
    }
}
