package de.bsommerfeld.fleetagent.updater.source;

import java.nio.file.Path;

/**
 * A downloaded, not yet verified release artifact.
 */
public record ArtifactHandle(VersionInfo info, Path file, long bytes) {
}
