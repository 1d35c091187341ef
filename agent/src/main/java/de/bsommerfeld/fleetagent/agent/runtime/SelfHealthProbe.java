package de.bsommerfeld.fleetagent.agent.runtime;

import de.bsommerfeld.fleetagent.updater.validation.HealthProbe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Minimal post-update health check: the agent must be able to write its
 * update state directory and the configuration must have loaded.
 */
public class SelfHealthProbe implements HealthProbe {

    private final Path workDir;
    private final boolean configLoaded;

    public SelfHealthProbe(Path workDir, boolean configLoaded) {
        this.workDir = workDir;
        this.configLoaded = configLoaded;
    }

    @Override
    public Optional<String> check() {
        if (!configLoaded) {
            return Optional.of("configuration could not be loaded");
        }
        try {
            Files.createDirectories(workDir);
            Path probe = Files.createTempFile(workDir, "health", ".probe");
            Files.delete(probe);
            return Optional.empty();
        } catch (IOException e) {
            return Optional.of("state directory " + workDir + " not writable: " + e.getMessage());
        }
    }
}
