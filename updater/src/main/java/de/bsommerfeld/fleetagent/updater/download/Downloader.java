package de.bsommerfeld.fleetagent.updater.download;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * HTTP download utility built on {@link HttpClient}.
 *
 * <p>
 * Artifacts stream into a {@code .tmp} sibling and are atomically renamed to
 * the target once complete, so a half-written file is never mistaken for a
 * finished download. The cancellation signal is polled after every chunk.
 */
public final class Downloader {

    private static final int CHUNK_SIZE = 8192;

    private final HttpClient http;
    private final Duration requestTimeout;

    public Downloader(Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(requestTimeout)
                .build(), requestTimeout);
    }

    Downloader(HttpClient http, Duration requestTimeout) {
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Streams {@code url} into {@code target}.
     *
     * @return number of bytes written
     * @throws DownloadCancelledException if {@code cancellation} fired
     * @throws IOException                on HTTP or I/O failure
     */
    public long toFile(String url, Path target, DownloadProgressListener listener, CancellationSignal cancellation)
            throws IOException {
        HttpResponse<InputStream> response = send(url, HttpResponse.BodyHandlers.ofInputStream());
        long totalBytes = response.headers().firstValueAsLong("Content-Length").orElse(-1);

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (InputStream in = response.body()) {
            long written = transferWithProgress(url, in, temp, totalBytes, listener, cancellation);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return written;
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private <T> HttpResponse<T> send(String url, HttpResponse.BodyHandler<T> handler) throws IOException {
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            HttpResponse<T> response = http.send(request, handler);
            validateStatus(response.statusCode(), url);
            return response;
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted: " + url, e);
        }
    }

    private static long transferWithProgress(String url, InputStream in, Path target, long totalBytes,
            DownloadProgressListener listener, CancellationSignal cancellation) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[CHUNK_SIZE];
            long transferred = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (cancellation.isCancelled()) {
                    throw new DownloadCancelledException(url);
                }
                out.write(buffer, 0, read);
                transferred += read;
                listener.onProgress(transferred, totalBytes);
            }
            return transferred;
        }
    }

    static void validateStatus(int status, String url) throws IOException {
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status + " for " + url);
        }
    }
}
