package de.bsommerfeld.fleetagent.updater.source;

import de.bsommerfeld.fleetagent.updater.download.CancellationSignal;
import de.bsommerfeld.fleetagent.updater.download.DownloadProgressListener;
import de.bsommerfeld.fleetagent.updater.update.UpdateException;

/**
 * Where releases come from and how they are applied. All calls may block
 * for network or disk I/O and are made outside the manager's lock.
 */
public interface VersionSource {

    /**
     * @return the newest release on the channel for this platform
     */
    VersionInfo checkLatest(String channel, String platform, String arch) throws UpdateException;

    /**
     * Downloads the artifact. Must poll {@code cancellation} regularly and
     * remove partial files when it fires.
     */
    ArtifactHandle download(VersionInfo info, DownloadProgressListener listener, CancellationSignal cancellation)
            throws UpdateException;

    /**
     * Checks the artifact's integrity. A mismatch must never reach
     * {@link #install(ArtifactHandle)}.
     */
    void verify(ArtifactHandle artifact) throws UpdateException;

    /**
     * Replaces the running binary with the artifact. Takes effect on the
     * next start.
     */
    void install(ArtifactHandle artifact) throws UpdateException;
}
