package de.bsommerfeld.fleetagent.updater.download;

import java.io.IOException;

/**
 * Raised by {@link Downloader} when its {@link CancellationSignal} fires.
 * The partial file has already been removed when this is thrown.
 */
public class DownloadCancelledException extends IOException {

    public DownloadCancelledException(String url) {
        super("Download cancelled: " + url);
    }
}
