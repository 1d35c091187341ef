package de.bsommerfeld.fleetagent.updater.marker;

import de.bsommerfeld.fleetagent.updater.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists the {@link RollbackMarker} as JSON. Writes are forced to disk
 * before {@link #write(RollbackMarker)} returns.
 */
public class RollbackMarkerStore {

    private static final Logger LOG = LoggerFactory.getLogger(RollbackMarkerStore.class);

    private final Path file;

    public RollbackMarkerStore(Path file) {
        this.file = file;
    }

    public void write(RollbackMarker marker) throws IOException {
        JsonSupport.writeDurably(file, marker);
        LOG.info("Rollback marker written: {} -> {}", marker.previousVersion(), marker.expectedNewVersion());
    }

    /**
     * @return the marker, or empty if none is present
     * @throws IOException if a marker exists but cannot be read or is incomplete
     */
    public Optional<RollbackMarker> read() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        RollbackMarker marker = JsonSupport.mapper().readValue(file.toFile(), RollbackMarker.class);
        if (marker == null || marker.expectedNewVersion() == null || marker.expectedNewVersion().isBlank()) {
            throw new IOException("Rollback marker " + file + " has no expected version");
        }
        return Optional.of(marker);
    }

    public boolean exists() {
        return Files.exists(file);
    }

    public void clear() throws IOException {
        if (Files.deleteIfExists(file)) {
            LOG.debug("Rollback marker cleared");
        }
    }

    public Path file() {
        return file;
    }
}
