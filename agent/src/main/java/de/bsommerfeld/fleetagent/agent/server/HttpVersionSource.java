package de.bsommerfeld.fleetagent.agent.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.CharMatcher;
import de.bsommerfeld.fleetagent.updater.download.CancellationSignal;
import de.bsommerfeld.fleetagent.updater.download.DownloadCancelledException;
import de.bsommerfeld.fleetagent.updater.download.DownloadProgressListener;
import de.bsommerfeld.fleetagent.updater.hash.HashUtil;
import de.bsommerfeld.fleetagent.updater.source.ArtifactHandle;
import de.bsommerfeld.fleetagent.updater.source.RestartTrigger;
import de.bsommerfeld.fleetagent.updater.source.VersionInfo;
import de.bsommerfeld.fleetagent.updater.source.VersionSource;
import de.bsommerfeld.fleetagent.updater.update.UpdateErrorCode;
import de.bsommerfeld.fleetagent.updater.update.UpdateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Release source backed by the fleet server's update manifest endpoint.
 *
 * <p>
 * The manifest names the download URL, size and SHA-256 of the agent binary
 * for one channel, platform and architecture. Artifacts land in the download
 * directory and are installed through a {@link BinaryInstaller}. The
 * restart is left to the {@link RestartTrigger}.
 */
public class HttpVersionSource implements VersionSource {

    private static final Logger LOG = LoggerFactory.getLogger(HttpVersionSource.class);

    static final String MANIFEST_PATH = "/api/v1/updates/agent/latest";

    private static final CharMatcher UNSAFE_FILE_CHARS = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("._-"))
            .negate();

    private final ServerConnection connection;
    private final Path downloadDir;
    private final BinaryInstaller installer;

    public HttpVersionSource(ServerConnection connection, Path downloadDir, BinaryInstaller installer) {
        this.connection = connection;
        this.downloadDir = downloadDir;
        this.installer = installer;
    }

    @Override
    public VersionInfo checkLatest(String channel, String platform, String arch) throws UpdateException {
        String path = MANIFEST_PATH
                + "?channel=" + encode(channel)
                + "&platform=" + encode(platform)
                + "&arch=" + encode(arch);
        JsonNode manifest;
        try {
            manifest = connection.getJson(path).orElseThrow(() -> new UpdateException(UpdateErrorCode.SERVER_ERROR,
                    "No release published for " + channel + " " + platform + "/" + arch));
        } catch (IOException e) {
            throw new UpdateException(UpdateErrorCode.SERVER_ERROR, "Update check failed: " + e.getMessage(), e);
        }
        return parseManifest(manifest, channel, platform, arch);
    }

    static VersionInfo parseManifest(JsonNode manifest, String channel, String platform, String arch)
            throws UpdateException {
        String version = manifest.path("version").asText("").trim();
        String downloadUrl = manifest.path("download_url").asText("").trim();
        if (version.isEmpty() || downloadUrl.isEmpty()) {
            throw new UpdateException(UpdateErrorCode.SERVER_ERROR, "Manifest lacks version or download URL");
        }
        Instant publishedAt = null;
        String published = manifest.path("published_at").asText("");
        if (!published.isEmpty()) {
            try {
                publishedAt = Instant.parse(published);
            } catch (DateTimeParseException e) {
                LOG.debug("Ignoring unparseable published_at '{}'", published);
            }
        }
        return new VersionInfo(
                version,
                manifest.path("channel").asText(channel),
                manifest.path("platform").asText(platform),
                manifest.path("arch").asText(arch),
                downloadUrl,
                manifest.path("sha256").asText(""),
                manifest.path("size_bytes").asLong(-1),
                publishedAt);
    }

    @Override
    public ArtifactHandle download(VersionInfo info, DownloadProgressListener listener,
            CancellationSignal cancellation) throws UpdateException {
        Path target = downloadDir.resolve(artifactName(info));
        try {
            long bytes = connection.download(info.downloadUrl(), target, listener, cancellation);
            LOG.info("Downloaded {} ({} bytes)", target.getFileName(), bytes);
            return new ArtifactHandle(info, target, bytes);
        } catch (DownloadCancelledException e) {
            deleteQuietly(target);
            throw new UpdateException(UpdateErrorCode.CANCELLED, "Download cancelled", e);
        } catch (IOException e) {
            deleteQuietly(target);
            throw new UpdateException(UpdateErrorCode.DOWNLOAD_FAILED, "Download failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void verify(ArtifactHandle artifact) throws UpdateException {
        VersionInfo info = artifact.info();
        if (info.sha256() == null || info.sha256().isBlank()) {
            reject(artifact, "Manifest carries no SHA-256 for " + info.version());
        }
        if (info.sizeBytes() > 0 && info.sizeBytes() != artifact.bytes()) {
            reject(artifact, "Size mismatch: expected " + info.sizeBytes() + " bytes, got " + artifact.bytes());
        }
        try {
            if (!HashUtil.matches(artifact.file(), info.sha256())) {
                reject(artifact, "SHA-256 mismatch for " + artifact.file().getFileName());
            }
        } catch (IOException e) {
            throw new UpdateException(UpdateErrorCode.HASH_MISMATCH, "Cannot hash artifact: " + e.getMessage(), e);
        }
        LOG.info("Verified {}", artifact.file().getFileName());
    }

    @Override
    public void install(ArtifactHandle artifact) throws UpdateException {
        try {
            installer.install(artifact.file());
        } catch (IOException e) {
            throw new UpdateException(UpdateErrorCode.INSTALL_FAILED, "Install failed: " + e.getMessage(), e);
        }
    }

    private void reject(ArtifactHandle artifact, String reason) throws UpdateException {
        deleteQuietly(artifact.file());
        throw new UpdateException(UpdateErrorCode.HASH_MISMATCH, reason);
    }

    static String artifactName(VersionInfo info) {
        String suffix = "windows".equals(info.platform()) ? ".exe" : "";
        String name = "fleet-agent-" + info.version() + "-" + info.platform() + "-" + info.arch();
        // Manifest values end up in a file name
        return UNSAFE_FILE_CHARS.replaceFrom(name, '_') + suffix;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to remove {}: {}", file, e.getMessage());
        }
    }
}
