package de.bsommerfeld.fleetagent.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Loads {@link AgentConfig} from a TOML file.
 *
 * <p>
 * A missing file is created with the default values so operators have a
 * complete template to edit. Unknown keys are ignored, missing keys keep
 * their defaults.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    public static AgentConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            AgentConfig defaults = new AgentConfig();
            save(configPath, defaults);
            LOG.info("Created default configuration at {}", configPath.toAbsolutePath());
            return defaults;
        }
        return MAPPER.readValue(configPath.toFile(), AgentConfig.class);
    }

    public static void save(Path configPath, AgentConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = configPath.resolveSibling(configPath.getFileName() + ".tmp");
        Files.writeString(temp, MAPPER.writeValueAsString(config));
        Files.move(temp, configPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
