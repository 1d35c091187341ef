package de.bsommerfeld.fleetagent.updater.update;

import de.bsommerfeld.fleetagent.updater.download.CancellationSignal;
import de.bsommerfeld.fleetagent.updater.download.DownloadProgressListener;
import de.bsommerfeld.fleetagent.updater.source.ArtifactHandle;
import de.bsommerfeld.fleetagent.updater.source.VersionInfo;
import de.bsommerfeld.fleetagent.updater.source.VersionSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Scriptable in-memory release source. Checks, downloads, verification and
 * installs can be held on latches to observe the manager mid-phase.
 */
class FakeVersionSource implements VersionSource {

    static final int ARTIFACT_SIZE = 4096;

    private final Path downloadDir;

    volatile String latestVersion = "1.3.0";
    volatile UpdateException checkFailure;
    volatile UpdateException verifyFailure;
    volatile UpdateException installFailure;

    volatile CountDownLatch checkGate;
    volatile CountDownLatch downloadGate;
    volatile CountDownLatch verifyGate;
    volatile CountDownLatch installGate;
    final CountDownLatch checkStarted = new CountDownLatch(1);
    final CountDownLatch downloadStarted = new CountDownLatch(1);
    final CountDownLatch verifyStarted = new CountDownLatch(1);
    final CountDownLatch installStarted = new CountDownLatch(1);

    volatile BooleanSupplier markerCheck = () -> true;
    volatile boolean markerPresentAtInstall;
    volatile Path lastArtifact;

    final AtomicInteger checks = new AtomicInteger();
    final AtomicInteger downloads = new AtomicInteger();
    final AtomicInteger verifies = new AtomicInteger();
    final AtomicInteger installs = new AtomicInteger();

    FakeVersionSource(Path downloadDir) {
        this.downloadDir = downloadDir;
    }

    @Override
    public VersionInfo checkLatest(String channel, String platform, String arch) throws UpdateException {
        checks.incrementAndGet();
        checkStarted.countDown();
        await(checkGate);
        if (checkFailure != null) {
            throw checkFailure;
        }
        return new VersionInfo(latestVersion, channel, platform, arch, "http://releases.test/" + latestVersion,
                "00", ARTIFACT_SIZE, Instant.EPOCH);
    }

    @Override
    public ArtifactHandle download(VersionInfo info, DownloadProgressListener listener,
            CancellationSignal cancellation) throws UpdateException {
        downloads.incrementAndGet();
        downloadStarted.countDown();
        await(downloadGate);
        Path file = downloadDir.resolve("agent-" + info.version());
        try {
            Files.createDirectories(downloadDir);
            Files.write(file, new byte[ARTIFACT_SIZE]);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        for (int read = 1024; read <= ARTIFACT_SIZE; read += 1024) {
            if (cancellation.isCancelled()) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                throw new UpdateException(UpdateErrorCode.CANCELLED, "Download cancelled");
            }
            listener.onProgress(read, ARTIFACT_SIZE);
        }
        lastArtifact = file;
        return new ArtifactHandle(info, file, ARTIFACT_SIZE);
    }

    @Override
    public void verify(ArtifactHandle artifact) throws UpdateException {
        verifies.incrementAndGet();
        verifyStarted.countDown();
        await(verifyGate);
        if (verifyFailure != null) {
            throw verifyFailure;
        }
    }

    @Override
    public void install(ArtifactHandle artifact) throws UpdateException {
        installs.incrementAndGet();
        markerPresentAtInstall = markerCheck.getAsBoolean();
        installStarted.countDown();
        await(installGate);
        if (installFailure != null) {
            throw installFailure;
        }
    }

    private static void await(CountDownLatch gate) {
        if (gate == null) {
            return;
        }
        try {
            if (!gate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Test gate never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
