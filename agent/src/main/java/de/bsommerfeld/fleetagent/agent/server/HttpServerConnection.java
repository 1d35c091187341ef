package de.bsommerfeld.fleetagent.agent.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import de.bsommerfeld.fleetagent.updater.download.CancellationSignal;
import de.bsommerfeld.fleetagent.updater.download.DownloadProgressListener;
import de.bsommerfeld.fleetagent.updater.download.Downloader;
import de.bsommerfeld.fleetagent.updater.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link ServerConnection} over {@link HttpClient} with JSON bodies.
 */
public class HttpServerConnection implements ServerConnection {

    private static final Logger LOG = LoggerFactory.getLogger(HttpServerConnection.class);

    private final String baseUrl;
    private final String agentId;
    private final Duration timeout;
    private final HttpClient http;
    private final Downloader downloader;
    private final ObjectMapper mapper = JsonSupport.mapper();

    public HttpServerConnection(String baseUrl, String agentId, Duration timeout) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.agentId = agentId;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
        // Artifacts can be large; the timeout bounds the wait for response headers only
        this.downloader = new Downloader(timeout);
    }

    @Override
    public Optional<JsonNode> getJson(String path) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = send(request);
        int status = response.statusCode();
        if (status == 204 || status == 404) {
            return Optional.empty();
        }
        requireSuccess(status, path, response.body());
        String body = response.body();
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(mapper.readTree(body));
    }

    @Override
    public void postJson(String path, Object body) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(request);
        requireSuccess(response.statusCode(), path, response.body());
    }

    @Override
    public long download(String url, Path target, DownloadProgressListener listener, CancellationSignal cancellation)
            throws IOException {
        String absolute = url.startsWith("/") ? baseUrl + url : url;
        LOG.debug("Downloading {} to {}", absolute, target);
        return downloader.toFile(absolute, target, listener, cancellation);
    }

    @Override
    public String agentPath(String suffix) {
        return "/api/v1/agents/" + URLEncoder.encode(agentId, StandardCharsets.UTF_8) + suffix;
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Request interrupted: " + request.uri(), e);
        }
    }

    private URI uri(String path) throws IOException {
        try {
            return URI.create(baseUrl + (path.startsWith("/") ? path : "/" + path));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid server URL: " + baseUrl + path, e);
        }
    }

    private static void requireSuccess(int status, String path, String body) throws IOException {
        if (status < 200 || status >= 300) {
            String detail = body == null || body.isBlank() ? "" : ": " + Ascii.truncate(body.strip(), 200, "...");
            throw new IOException("HTTP " + status + " from " + path + detail);
        }
    }

    private static String stripTrailingSlash(String url) {
        return CharMatcher.is('/').trimTrailingFrom(url == null ? "" : url.trim());
    }
}
