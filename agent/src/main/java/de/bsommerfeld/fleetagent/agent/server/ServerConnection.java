package de.bsommerfeld.fleetagent.agent.server;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.fleetagent.updater.download.CancellationSignal;
import de.bsommerfeld.fleetagent.updater.download.DownloadProgressListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * HTTP plumbing towards the fleet server. Paths are relative to the server's
 * base URL.
 */
public interface ServerConnection {

    /**
     * @return the response body, or empty if the server answered 204 or 404
     */
    Optional<JsonNode> getJson(String path) throws IOException;

    void postJson(String path, Object body) throws IOException;

    /**
     * Streams {@code url}, absolute or server-relative, into {@code target}.
     *
     * @return number of bytes written
     */
    long download(String url, Path target, DownloadProgressListener listener, CancellationSignal cancellation)
            throws IOException;

    /**
     * @return {@code /api/v1/agents/<agent-id><suffix>}
     */
    String agentPath(String suffix);
}
