package de.bsommerfeld.fleetagent.updater.download;

/**
 * Receives byte counts while an artifact streams to disk.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (bytesRead, totalBytes) -> {
    };

    /**
     * @param bytesRead  bytes transferred so far
     * @param totalBytes expected size, or -1 if the server did not say
     */
    void onProgress(long bytesRead, long totalBytes);
}
