package de.bsommerfeld.fleetagent.agent.offline;

import de.bsommerfeld.fleetagent.updater.download.CancellationSignal;
import de.bsommerfeld.fleetagent.updater.download.DownloadProgressListener;
import de.bsommerfeld.fleetagent.updater.hash.HashUtil;
import de.bsommerfeld.fleetagent.updater.source.ArtifactHandle;
import de.bsommerfeld.fleetagent.updater.source.VersionInfo;
import de.bsommerfeld.fleetagent.updater.source.VersionSource;
import de.bsommerfeld.fleetagent.updater.update.UpdateErrorCode;
import de.bsommerfeld.fleetagent.updater.update.UpdateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;

/**
 * Offline stand-in for the server-backed release source when the agent runs
 * in TEST mode.
 *
 * <h3>No network access</h3>
 * The only release on offer is the running version, so scheduled checks
 * always end up to date. A forced install walks the full pipeline against a
 * synthetic artifact: the download is written in chunks with progress and
 * cancellation, the checksum is real, and the install step discards the
 * file instead of replacing the binary. The next start then validates
 * successfully because the expected version is the running one.
 */
public class OfflineVersionSource implements VersionSource {

    private static final Logger LOG = LoggerFactory.getLogger(OfflineVersionSource.class);

    static final int ARTIFACT_SIZE = 256 * 1024;
    private static final int CHUNK_SIZE = 16 * 1024;

    private final String currentVersion;
    private final Path downloadDir;

    public OfflineVersionSource(String currentVersion, Path downloadDir) {
        this.currentVersion = currentVersion;
        this.downloadDir = downloadDir;
    }

    @Override
    public VersionInfo checkLatest(String channel, String platform, String arch) {
        return new VersionInfo(currentVersion, channel, platform, arch, "offline:" + currentVersion, "",
                ARTIFACT_SIZE, Instant.EPOCH);
    }

    @Override
    public ArtifactHandle download(VersionInfo info, DownloadProgressListener listener,
            CancellationSignal cancellation) throws UpdateException {
        Path target = downloadDir.resolve("fleet-agent-offline-" + info.version());
        byte[] chunk = new byte[CHUNK_SIZE];
        Arrays.fill(chunk, (byte) 0x2A);
        try {
            Files.createDirectories(downloadDir);
            long written = 0;
            try (OutputStream out = Files.newOutputStream(target)) {
                while (written < ARTIFACT_SIZE) {
                    if (cancellation.isCancelled()) {
                        out.close();
                        Files.deleteIfExists(target);
                        throw new UpdateException(UpdateErrorCode.CANCELLED, "Download cancelled");
                    }
                    out.write(chunk);
                    written += chunk.length;
                    listener.onProgress(written, ARTIFACT_SIZE);
                }
            }
            String sha256 = HashUtil.sha256(target);
            VersionInfo withHash = new VersionInfo(info.version(), info.channel(), info.platform(), info.arch(),
                    info.downloadUrl(), sha256, ARTIFACT_SIZE, info.publishedAt());
            return new ArtifactHandle(withHash, target, written);
        } catch (IOException e) {
            throw new UpdateException(UpdateErrorCode.DOWNLOAD_FAILED, "Synthetic download failed: " + e.getMessage(),
                    e);
        }
    }

    @Override
    public void verify(ArtifactHandle artifact) throws UpdateException {
        try {
            if (!HashUtil.matches(artifact.file(), artifact.info().sha256())) {
                throw new UpdateException(UpdateErrorCode.HASH_MISMATCH, "Synthetic artifact corrupted");
            }
        } catch (IOException e) {
            throw new UpdateException(UpdateErrorCode.HASH_MISMATCH, "Cannot hash artifact: " + e.getMessage(), e);
        }
    }

    @Override
    public void install(ArtifactHandle artifact) throws UpdateException {
        try {
            Files.deleteIfExists(artifact.file());
        } catch (IOException e) {
            throw new UpdateException(UpdateErrorCode.INSTALL_FAILED, "Cannot discard artifact: " + e.getMessage(), e);
        }
        LOG.info("TEST mode: skipped replacing the binary with {}", artifact.info().version());
    }
}
