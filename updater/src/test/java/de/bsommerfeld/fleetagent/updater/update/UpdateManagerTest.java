package de.bsommerfeld.fleetagent.updater.update;

import de.bsommerfeld.fleetagent.updater.marker.RollbackMarker;
import de.bsommerfeld.fleetagent.updater.marker.RollbackMarkerStore;
import de.bsommerfeld.fleetagent.updater.policy.AgentOverrideMode;
import de.bsommerfeld.fleetagent.updater.policy.MaintenanceWindow;
import de.bsommerfeld.fleetagent.updater.policy.PolicySource;
import de.bsommerfeld.fleetagent.updater.policy.PolicySpec;
import de.bsommerfeld.fleetagent.updater.policy.VersionPinStrategy;
import de.bsommerfeld.fleetagent.updater.progress.ProgressEvent;
import de.bsommerfeld.fleetagent.updater.source.RestartTrigger;
import de.bsommerfeld.fleetagent.updater.telemetry.TelemetryReporter;
import de.bsommerfeld.fleetagent.updater.telemetry.TelemetrySink;
import de.bsommerfeld.fleetagent.updater.validation.FailedVersionRegistry;
import de.bsommerfeld.fleetagent.updater.validation.PostUpdateValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Drives the update state machine against an in-memory release source.
 */
class UpdateManagerTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ExecutorService background = Executors.newCachedThreadPool();

    private FixedPolicyProvider policies;
    private FakeVersionSource source;
    private RecordingProgressSink sink;
    private RestartTrigger restart;
    private TelemetrySink telemetrySink;
    private RollbackMarkerStore markerStore;
    private FailedVersionRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        policies = new FixedPolicyProvider();
        policies.local = policy(VersionPinStrategy.LATEST, "");
        source = new FakeVersionSource(tempDir.resolve("downloads"));
        sink = new RecordingProgressSink();
        restart = mock(RestartTrigger.class);
        when(restart.restart()).thenReturn(true);
        telemetrySink = mock(TelemetrySink.class);
        markerStore = new RollbackMarkerStore(tempDir.resolve("rollback-marker.json"));
        registry = new FailedVersionRegistry(tempDir.resolve("failed-versions.json"), Duration.ofHours(24), clock);
        source.markerCheck = markerStore::exists;
    }

    @AfterEach
    void tearDown() {
        background.shutdownNow();
    }

    private static PolicySpec policy(VersionPinStrategy strategy, String target) {
        return new PolicySpec(7, strategy, false, target, true, MaintenanceWindow.DISABLED);
    }

    private UpdateManager newManager(String currentVersion) {
        var settings = new UpdaterSettings("agent-1", currentVersion, "stable", "linux", "amd64", tempDir, 1,
                Duration.ofHours(1), Duration.ofSeconds(5));
        var validator = new PostUpdateValidator(markerStore, registry, Optional::empty);
        return new UpdateManager(settings, policies, source, restart, sink, markerStore, registry, validator,
                new TelemetryReporter(telemetrySink), clock);
    }

    private UpdateManager newManager() {
        return newManager("1.2.3");
    }

    private static void assertMonotonic(List<ProgressEvent> events) {
        int previous = Integer.MIN_VALUE;
        for (ProgressEvent event : events) {
            if (event.progress() == -1) {
                assertTrue(event.status().isUnsuccessful(), "only unsuccessful events report -1");
                continue;
            }
            assertTrue(event.progress() >= previous, "progress went backwards at " + event);
            previous = event.progress();
        }
    }

    // -- happy path --

    @Test
    void checkNow_shouldInstallEligibleUpdateAndRestart() throws Exception {
        var manager = newManager();

        UpdateStatus result = manager.checkNow();

        assertEquals(UpdateStatus.AWAITING_RESTART, result);
        assertEquals(List.of(UpdateStatus.CHECKING, UpdateStatus.AVAILABLE, UpdateStatus.DOWNLOADING,
                UpdateStatus.VERIFYING, UpdateStatus.INSTALLING, UpdateStatus.AWAITING_RESTART), sink.phases());
        assertEquals(1, source.installs.get());
        verify(restart).restart();
        assertMonotonic(sink.events);
        assertEquals("1.3.0", sink.last().targetVersion());
    }

    @Test
    void checkNow_shouldWriteMarkerBeforeInstall() throws Exception {
        var manager = newManager();

        manager.checkNow();

        assertTrue(source.markerPresentAtInstall);
        RollbackMarker marker = markerStore.read().orElseThrow();
        assertEquals("1.2.3", marker.previousVersion());
        assertEquals("1.3.0", marker.expectedNewVersion());
    }

    @Test
    void checkNow_shouldReportDownloadProgressWithinDownloadRange() throws Exception {
        var manager = newManager();

        manager.checkNow();

        List<ProgressEvent> downloading = sink.events.stream()
                .filter(e -> e.status() == UpdateStatus.DOWNLOADING)
                .toList();
        assertTrue(downloading.size() > 1);
        assertEquals(UpdateManager.PROGRESS_DOWNLOAD_START, downloading.get(0).progress());
        assertEquals(UpdateManager.PROGRESS_DOWNLOAD_END, downloading.get(downloading.size() - 1).progress());
    }

    @Test
    void checkNow_shouldReportTelemetryWhenCollectionEnabled() throws Exception {
        var manager = newManager();

        manager.checkNow();

        verify(telemetrySink, timeout(5000)).report(argThat(p -> p.status().equals("awaiting_restart")
                && p.targetVersion().equals("1.3.0") && p.agentId().equals("agent-1")));
    }

    @Test
    void checkNow_shouldNotReportTelemetryWhenCollectionDisabled() throws Exception {
        policies.local = new PolicySpec(7, VersionPinStrategy.LATEST, false, "", false, MaintenanceWindow.DISABLED);
        var manager = newManager();

        manager.checkNow();

        verify(telemetrySink, after(300).never()).report(any());
    }

    // -- eligibility --

    @Test
    void checkNow_patchPolicyShouldEmitSingleUpToDateForMinorBump() throws Exception {
        policies.local = policy(VersionPinStrategy.PATCH, "");
        source.latestVersion = "1.3.0";
        var manager = newManager("1.2.3");

        UpdateStatus result = manager.checkNow();

        assertEquals(UpdateStatus.UP_TO_DATE, result);
        assertEquals(1, sink.count(UpdateStatus.UP_TO_DATE));
        assertEquals(List.of(UpdateStatus.CHECKING, UpdateStatus.UP_TO_DATE), sink.statuses());
        assertEquals(0, source.downloads.get());
        assertEquals(0, source.installs.get());
        assertEquals(UpdateStatus.IDLE, manager.status().status());
    }

    @Test
    void checkNow_pinWithoutTargetShouldReportUpToDateWithoutError() throws Exception {
        policies.local = policy(VersionPinStrategy.PIN, "");
        var manager = newManager();

        UpdateStatus result = manager.checkNow();

        assertEquals(UpdateStatus.UP_TO_DATE, result);
        assertEquals(0, sink.count(UpdateStatus.FAILED));
        assertEquals(0, source.installs.get());
    }

    @Test
    void checkNow_shouldHonourPinnedTarget() throws Exception {
        policies.local = policy(VersionPinStrategy.PIN, "1.3.0");
        source.latestVersion = "1.4.0";
        var manager = newManager();

        assertEquals(UpdateStatus.UP_TO_DATE, manager.checkNow());
        assertEquals(0, source.installs.get());
    }

    @Test
    void checkNow_shouldSkipRecentlyFailedVersionButNotOthers() throws Exception {
        registry.recordFailure("1.3.0");
        var manager = newManager();

        assertEquals(UpdateStatus.UP_TO_DATE, manager.checkNow());
        assertTrue(sink.last().message().contains("1.3.0"));

        source.latestVersion = "1.3.1";
        assertEquals(UpdateStatus.AWAITING_RESTART, newManager().checkNow());
    }

    @Test
    void checkNow_shouldRetryFailedVersionAfterCooldown() throws Exception {
        new FailedVersionRegistry(tempDir.resolve("failed-versions.json"), Duration.ofHours(24),
                Clock.fixed(NOW.minus(Duration.ofHours(25)), ZoneOffset.UTC)).recordFailure("1.3.0");
        registry = new FailedVersionRegistry(tempDir.resolve("failed-versions.json"), Duration.ofHours(24), clock);

        assertEquals(UpdateStatus.AWAITING_RESTART, newManager().checkNow());
    }

    // -- disabled mode --

    @Test
    void checkNow_shouldRefuseInNeverModeWithSingleFailedEvent() {
        policies.mode = AgentOverrideMode.NEVER;
        var manager = newManager();

        assertThrows(UpdateDisabledException.class, manager::checkNow);

        assertEquals(List.of(UpdateStatus.FAILED), sink.statuses());
        assertEquals(-1, sink.last().progress());
        assertFalse(sink.last().error().isEmpty());
        assertEquals(0, source.checks.get());
    }

    @Test
    void forceInstallLatest_shouldRefuseInNeverModeWithSingleFailedEvent() {
        policies.mode = AgentOverrideMode.NEVER;
        var manager = newManager();

        var ex = assertThrows(UpdateDisabledException.class, () -> manager.forceInstallLatest("hotfix"));

        assertEquals(UpdateErrorCode.POLICY_DISABLED, ex.getCode());
        assertEquals(1, sink.events.size());
        assertEquals(UpdateStatus.FAILED, sink.last().status());
        assertEquals(0, source.checks.get());
        assertEquals(UpdateStatus.IDLE, manager.status().status());
    }

    // -- forced installs --

    @Test
    void forceInstallLatest_shouldBypassStrategyAndCarryReason() throws Exception {
        policies.local = policy(VersionPinStrategy.PATCH, "");
        var manager = newManager();

        UpdateStatus result = manager.forceInstallLatest("security hotfix");

        assertEquals(UpdateStatus.AWAITING_RESTART, result);
        assertEquals(1, source.installs.get());
        assertEquals("security hotfix", markerStore.read().orElseThrow().reason());
    }

    @Test
    void forceInstallLatest_shouldReinstallSameVersion() throws Exception {
        source.latestVersion = "1.2.3";
        var manager = newManager("1.2.3");

        assertEquals(UpdateStatus.AWAITING_RESTART, manager.forceInstallLatest(""));
        assertEquals(1, source.installs.get());
    }

    @Test
    void forceInstallLatest_shouldIgnoreFailedVersionExclusion() throws Exception {
        registry.recordFailure("1.3.0");
        var manager = newManager();

        assertEquals(UpdateStatus.AWAITING_RESTART, manager.forceInstallLatest("retry"));
    }

    // -- failures --

    @Test
    void checkNow_shouldFailAndReturnToIdleWhenServerUnreachable() throws Exception {
        source.checkFailure = new UpdateException(UpdateErrorCode.SERVER_ERROR, "HTTP 503 from release server");
        var manager = newManager();

        assertEquals(UpdateStatus.FAILED, manager.checkNow());

        ProgressEvent failed = sink.last();
        assertEquals(UpdateStatus.FAILED, failed.status());
        assertEquals(-1, failed.progress());
        assertTrue(failed.error().contains("503"));
        assertEquals(UpdateStatus.IDLE, manager.status().status());

        source.checkFailure = null;
        assertEquals(UpdateStatus.AWAITING_RESTART, manager.checkNow());
    }

    @Test
    void checkNow_shouldNeverInstallWhenVerificationFails() throws Exception {
        source.verifyFailure = new UpdateException(UpdateErrorCode.HASH_MISMATCH, "SHA-256 mismatch");
        var manager = newManager();

        assertEquals(UpdateStatus.FAILED, manager.checkNow());

        assertEquals(0, source.installs.get());
        assertFalse(markerStore.exists());
        assertFalse(Files.exists(source.lastArtifact));
    }

    @Test
    void checkNow_shouldRemoveMarkerWhenInstallFails() throws Exception {
        source.installFailure = new UpdateException(UpdateErrorCode.INSTALL_FAILED, "binary locked");
        var manager = newManager();

        assertEquals(UpdateStatus.FAILED, manager.checkNow());

        assertTrue(source.markerPresentAtInstall);
        assertFalse(markerStore.exists());
        verifyNoInteractions(restart);
    }

    @Test
    void checkNow_shouldKeepMarkerWhenRestartFails() throws Exception {
        doThrow(new UpdateException(UpdateErrorCode.RESTART_FAILED, "service manager unavailable"))
                .when(restart).restart();
        var manager = newManager();

        assertEquals(UpdateStatus.FAILED, manager.checkNow());

        assertTrue(markerStore.exists());
        assertEquals(UpdateStatus.FAILED, sink.last().status());
        assertEquals(UpdateStatus.IDLE, manager.status().status());
    }

    @Test
    void checkNow_shouldReleaseSessionWhenRestartDeclined() throws Exception {
        when(restart.restart()).thenReturn(false);
        var manager = newManager();

        assertEquals(UpdateStatus.AWAITING_RESTART, manager.checkNow());

        assertTrue(markerStore.exists());
        assertEquals(UpdateStatus.AWAITING_RESTART, sink.last().status());
        assertEquals(UpdateStatus.IDLE, manager.status().status());
        assertDoesNotThrow(manager::checkNow);
        assertEquals(2, source.checks.get());
    }

    @Test
    void checkNow_shouldStayBusyWhileRestartIsUnderway() throws Exception {
        var manager = newManager();

        assertEquals(UpdateStatus.AWAITING_RESTART, manager.checkNow());

        assertEquals(UpdateStatus.AWAITING_RESTART, manager.status().status());
        assertThrows(UpdateBusyException.class, manager::checkNow);
    }

    @Test
    void checkNow_shouldFailWhenDiskSpaceInsufficient() throws Exception {
        var settings = new UpdaterSettings("agent-1", "1.2.3", "stable", "linux", "amd64", tempDir,
                Long.MAX_VALUE / (1024 * 1024), Duration.ofHours(1), Duration.ofSeconds(5));
        var manager = new UpdateManager(settings, policies, source, restart, sink, markerStore, registry,
                new PostUpdateValidator(markerStore, registry, Optional::empty),
                new TelemetryReporter(telemetrySink), clock);

        assertEquals(UpdateStatus.FAILED, manager.checkNow());
        assertTrue(sink.last().error().toLowerCase().contains("disk space"));
        assertEquals(0, source.downloads.get());
    }

    // -- cancellation --

    @Test
    void cancel_shouldReturnFalseWhenIdle() {
        assertFalse(newManager().cancel());
        assertTrue(sink.events.isEmpty());
    }

    @Test
    void cancel_shouldStopDownloadAndReleaseSession() throws Exception {
        source.downloadGate = new CountDownLatch(1);
        var manager = newManager();

        Future<UpdateStatus> run = background.submit(manager::checkNow);
        assertTrue(source.downloadStarted.await(5, TimeUnit.SECONDS));

        assertTrue(manager.cancel());
        assertEquals(UpdateStatus.CANCELLED, sink.last().status());
        assertEquals(-1, sink.last().progress());
        assertFalse(manager.cancel());

        source.downloadGate.countDown();
        assertEquals(UpdateStatus.CANCELLED, run.get(5, TimeUnit.SECONDS));

        assertEquals(1, sink.count(UpdateStatus.CANCELLED));
        assertEquals(0, source.verifies.get());
        assertEquals(0, source.installs.get());
        assertFalse(markerStore.exists());
        assertEquals(UpdateStatus.IDLE, manager.status().status());
    }

    @Test
    void cancel_shouldBeRefusedWhileInstalling() throws Exception {
        source.installGate = new CountDownLatch(1);
        var manager = newManager();

        Future<UpdateStatus> run = background.submit(manager::checkNow);
        assertTrue(source.installStarted.await(5, TimeUnit.SECONDS));

        assertFalse(manager.cancel());
        assertEquals(UpdateStatus.INSTALLING, manager.status().status());

        source.installGate.countDown();
        assertEquals(UpdateStatus.AWAITING_RESTART, run.get(5, TimeUnit.SECONDS));
        assertEquals(0, sink.count(UpdateStatus.CANCELLED));
    }

    @Test
    void cancel_shouldStopWhileCheckingBeforeAnyDownload() throws Exception {
        source.checkGate = new CountDownLatch(1);
        var manager = newManager();

        Future<UpdateStatus> run = background.submit(manager::checkNow);
        assertTrue(source.checkStarted.await(5, TimeUnit.SECONDS));
        assertEquals(UpdateStatus.CHECKING, manager.status().status());

        assertTrue(manager.cancel());

        source.checkGate.countDown();
        assertEquals(UpdateStatus.CANCELLED, run.get(5, TimeUnit.SECONDS));

        assertEquals(List.of(UpdateStatus.CHECKING, UpdateStatus.CANCELLED), sink.statuses());
        assertEquals(0, source.downloads.get());
        assertEquals(0, source.installs.get());
        assertFalse(markerStore.exists());
        assertEquals(UpdateStatus.IDLE, manager.status().status());
    }

    @Test
    void cancel_shouldStopWhileVerifyingAndDropArtifact() throws Exception {
        source.verifyGate = new CountDownLatch(1);
        var manager = newManager();

        Future<UpdateStatus> run = background.submit(manager::checkNow);
        assertTrue(source.verifyStarted.await(5, TimeUnit.SECONDS));
        assertEquals(UpdateStatus.VERIFYING, manager.status().status());

        assertTrue(manager.cancel());

        source.verifyGate.countDown();
        assertEquals(UpdateStatus.CANCELLED, run.get(5, TimeUnit.SECONDS));

        assertEquals(1, sink.count(UpdateStatus.CANCELLED));
        assertEquals(0, sink.count(UpdateStatus.INSTALLING));
        assertEquals(0, source.installs.get());
        assertFalse(markerStore.exists());
        assertFalse(Files.exists(source.lastArtifact));
        assertEquals(UpdateStatus.IDLE, manager.status().status());
    }

    @Test
    void cancel_shouldBeRefusedWhileAwaitingRestart() throws Exception {
        var restarting = new CountDownLatch(1);
        var restartGate = new CountDownLatch(1);
        when(restart.restart()).thenAnswer(invocation -> {
            restarting.countDown();
            return restartGate.await(5, TimeUnit.SECONDS);
        });
        var manager = newManager();

        Future<UpdateStatus> run = background.submit(manager::checkNow);
        assertTrue(restarting.await(5, TimeUnit.SECONDS));
        int eventsBefore = sink.events.size();

        assertFalse(manager.cancel());

        assertEquals(eventsBefore, sink.events.size());
        assertEquals(UpdateStatus.AWAITING_RESTART, manager.status().status());
        assertEquals(UpdateManager.PROGRESS_AWAITING_RESTART, manager.status().progress());

        restartGate.countDown();
        assertEquals(UpdateStatus.AWAITING_RESTART, run.get(5, TimeUnit.SECONDS));
        assertEquals(0, sink.count(UpdateStatus.CANCELLED));
        assertTrue(markerStore.exists());
    }

    @Test
    void cancel_shouldKeepSessionBusyUntilWorkerReachesCheckpoint() throws Exception {
        source.downloadGate = new CountDownLatch(1);
        var manager = newManager();

        Future<UpdateStatus> run = background.submit(manager::checkNow);
        assertTrue(source.downloadStarted.await(5, TimeUnit.SECONDS));
        assertTrue(manager.cancel());

        assertEquals(UpdateStatus.CANCELLED, manager.status().status());
        assertThrows(UpdateBusyException.class, manager::checkNow);
        assertEquals(1, source.checks.get());

        source.downloadGate.countDown();
        assertEquals(UpdateStatus.CANCELLED, run.get(5, TimeUnit.SECONDS));

        assertEquals(UpdateStatus.IDLE, manager.status().status());
        assertEquals(UpdateStatus.AWAITING_RESTART, manager.checkNow());
        assertEquals(2, source.checks.get());
    }

    // -- exclusivity --

    @Test
    void checkNow_shouldRejectConcurrentRequestsAsBusy() throws Exception {
        source.downloadGate = new CountDownLatch(1);
        var manager = newManager();
        int callers = 8;
        var start = new CountDownLatch(1);
        var busy = new AtomicInteger();
        var busyDone = new CountDownLatch(callers - 1);
        List<Future<UpdateStatus>> results = new ArrayList<>();

        for (int i = 0; i < callers; i++) {
            results.add(background.submit(() -> {
                start.await();
                try {
                    return manager.checkNow();
                } catch (UpdateBusyException e) {
                    busy.incrementAndGet();
                    busyDone.countDown();
                    return UpdateStatus.IDLE;
                }
            }));
        }
        start.countDown();

        assertTrue(busyDone.await(5, TimeUnit.SECONDS));
        assertTrue(source.downloadStarted.await(5, TimeUnit.SECONDS));
        assertEquals(UpdateStatus.DOWNLOADING, manager.status().status());

        source.downloadGate.countDown();
        List<UpdateStatus> outcomes = new ArrayList<>();
        for (Future<UpdateStatus> result : results) {
            outcomes.add(result.get(5, TimeUnit.SECONDS));
        }

        assertEquals(callers - 1, busy.get());
        assertEquals(1, outcomes.stream().filter(s -> s == UpdateStatus.AWAITING_RESTART).count());
        assertEquals(1, source.checks.get());
        assertEquals(1, source.downloads.get());
        assertEquals(1, sink.count(UpdateStatus.CHECKING));
    }

    @Test
    void status_shouldNotBlockDuringDownload() throws Exception {
        source.downloadGate = new CountDownLatch(1);
        var manager = newManager();

        Future<UpdateStatus> run = background.submit(manager::checkNow);
        assertTrue(source.downloadStarted.await(5, TimeUnit.SECONDS));

        Future<ManagerStatus> snapshot = background.submit(manager::status);
        ManagerStatus status = snapshot.get(1, TimeUnit.SECONDS);
        assertEquals(UpdateStatus.DOWNLOADING, status.status());
        assertEquals("1.3.0", status.latestVersion());
        assertTrue(status.updateAvailable());
        assertEquals(PolicySource.LOCAL, status.policySource());

        source.downloadGate.countDown();
        run.get(5, TimeUnit.SECONDS);
    }

    // -- post-update validation --

    @Test
    void validatePostUpdate_shouldDoNothingWithoutMarker() throws Exception {
        PostUpdateResult result = newManager().validatePostUpdate();

        assertFalse(result.updated());
        assertTrue(sink.events.isEmpty());
    }

    @Test
    void validatePostUpdate_shouldSucceedAndClearMarker() throws Exception {
        markerStore.write(new RollbackMarker("1.2.3", "1.3.0", NOW, "run-1", ""));
        var manager = newManager("1.3.0");

        PostUpdateResult result = manager.validatePostUpdate();

        assertTrue(result.updated());
        assertEquals(UpdateStatus.SUCCEEDED, result.status());
        assertEquals(List.of(UpdateStatus.VALIDATING, UpdateStatus.SUCCEEDED), sink.statuses());
        assertEquals(100, sink.last().progress());
        assertFalse(markerStore.exists());
        assertEquals(UpdateStatus.IDLE, manager.status().status());
    }

    @Test
    void validatePostUpdate_shouldFailOnMismatchAndExcludeVersion() throws Exception {
        markerStore.write(new RollbackMarker("1.2.3", "1.3.0", NOW, "run-1", ""));
        var manager = newManager("1.2.9");

        PostUpdateResult result = manager.validatePostUpdate();

        assertEquals(UpdateStatus.FAILED, result.status());
        assertEquals(List.of(UpdateStatus.VALIDATING, UpdateStatus.FAILED), sink.statuses());
        assertFalse(markerStore.exists());

        source.latestVersion = "1.3.0";
        assertEquals(UpdateStatus.UP_TO_DATE, manager.checkNow());
        assertEquals(0, source.installs.get());
    }

    @Test
    void validatePostUpdate_shouldReportRollback() throws Exception {
        markerStore.write(new RollbackMarker("1.2.3", "1.3.0", NOW, "run-1", ""));
        var manager = newManager("1.2.3");

        PostUpdateResult result = manager.validatePostUpdate();

        assertEquals(UpdateStatus.ROLLED_BACK, result.status());
        assertEquals(UpdateStatus.ROLLED_BACK, sink.last().status());
        assertEquals(-1, sink.last().progress());
    }

    @Test
    void validatePostUpdate_shouldDiscardCorruptMarker() throws Exception {
        Files.writeString(markerStore.file(), "garbage");
        var manager = newManager();

        PostUpdateResult result = manager.validatePostUpdate();

        assertEquals(UpdateErrorCode.MARKER_CORRUPT, result.errorCode());
        assertEquals(UpdateStatus.FAILED, sink.last().status());
        assertFalse(markerStore.exists());
    }

    @Test
    void validatePostUpdate_shouldRunEvenWhenAutoUpdateDisabled() throws Exception {
        policies.mode = AgentOverrideMode.NEVER;
        markerStore.write(new RollbackMarker("1.2.3", "1.3.0", NOW, "run-1", ""));

        PostUpdateResult result = newManager("1.3.0").validatePostUpdate();

        assertEquals(UpdateStatus.SUCCEEDED, result.status());
    }

    // -- scheduled loop --

    @Test
    void runScheduledCycle_shouldCheckWhenDue() {
        var manager = newManager();

        manager.runScheduledCycle();

        assertEquals(1, source.checks.get());
        ManagerStatus status = manager.status();
        assertEquals(NOW, status.lastCheckAt());
        assertNotNull(status.nextCheckAt());
        assertFalse(status.nextCheckAt().isBefore(NOW.plus(Duration.ofDays(7))));
        assertFalse(status.nextCheckAt().isAfter(NOW.plus(Duration.ofDays(7)).plus(Duration.ofHours(17))));
    }

    @Test
    void runScheduledCycle_shouldNotCheckAgainBeforeInterval() {
        source.latestVersion = "1.2.3";
        var manager = newManager();

        manager.runScheduledCycle();
        manager.runScheduledCycle();

        assertEquals(1, source.checks.get());
    }

    @Test
    void runScheduledCycle_shouldSkipOutsideMaintenanceWindow() {
        policies.local = new PolicySpec(7, VersionPinStrategy.LATEST, false, "", true,
                new MaintenanceWindow(true, 2, 0, 4, 0, "UTC", Set.of()));
        var manager = newManager();

        manager.runScheduledCycle();

        assertEquals(0, source.checks.get());
    }

    @Test
    void runScheduledCycle_shouldNotCheckWhenIntervalIsZero() {
        policies.local = new PolicySpec(0, VersionPinStrategy.LATEST, false, "", true, MaintenanceWindow.DISABLED);
        var manager = newManager();

        manager.runScheduledCycle();

        assertEquals(0, source.checks.get());
        assertNull(manager.status().nextCheckAt());
    }

    @Test
    void runScheduledCycle_shouldStayQuietInNeverMode() {
        policies.mode = AgentOverrideMode.NEVER;
        var manager = newManager();

        manager.runScheduledCycle();

        assertEquals(0, source.checks.get());
        assertTrue(sink.events.isEmpty());
        assertFalse(manager.status().enabled());
    }

    @Test
    void stop_shouldCancelRunningDownload() throws Exception {
        source.downloadGate = new CountDownLatch(1);
        var manager = newManager();

        Future<UpdateStatus> run = background.submit(manager::checkNow);
        assertTrue(source.downloadStarted.await(5, TimeUnit.SECONDS));

        manager.stop(Duration.ofSeconds(1));
        source.downloadGate.countDown();

        assertEquals(UpdateStatus.CANCELLED, run.get(5, TimeUnit.SECONDS));
    }
}
