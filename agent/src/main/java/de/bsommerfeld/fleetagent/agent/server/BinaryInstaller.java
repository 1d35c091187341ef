package de.bsommerfeld.fleetagent.agent.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Replaces the agent binary with a verified artifact.
 *
 * <p>
 * The current binary is copied to the backup directory first. The artifact
 * is staged next to the binary and moved over it atomically, so the binary
 * path always holds a complete file. A failed move restores the backup.
 */
public class BinaryInstaller {

    private static final Logger LOG = LoggerFactory.getLogger(BinaryInstaller.class);

    private final Path binary;
    private final Path backupDir;

    public BinaryInstaller(Path binary, Path backupDir) {
        this.binary = binary;
        this.backupDir = backupDir;
    }

    public void install(Path artifact) throws IOException {
        if (!Files.isRegularFile(artifact)) {
            throw new IOException("Artifact missing: " + artifact);
        }
        Path backup = backup();
        Path staged = binary.resolveSibling(binary.getFileName() + ".new");
        try {
            Files.copy(artifact, staged, StandardCopyOption.REPLACE_EXISTING);
            if (!staged.toFile().setExecutable(true, false)) {
                LOG.debug("Could not mark {} executable", staged);
            }
            Files.move(staged, binary, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(staged);
            if (backup != null && !Files.exists(binary)) {
                Files.copy(backup, binary, StandardCopyOption.REPLACE_EXISTING);
                LOG.warn("Restored {} from backup after failed install", binary);
            }
            throw e;
        }
        Files.deleteIfExists(artifact);
        LOG.info("Installed new binary at {}", binary);
    }

    /**
     * @return where the previous binary was saved, or {@code null} on a
     *         fresh install
     */
    Path backup() throws IOException {
        if (!Files.isRegularFile(binary)) {
            return null;
        }
        Files.createDirectories(backupDir);
        Path backup = backupFile();
        Files.copy(binary, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        LOG.debug("Backed up {} to {}", binary, backup);
        return backup;
    }

    public Path backupFile() {
        return backupDir.resolve(binary.getFileName() + ".bak");
    }
}
