package de.bsommerfeld.fleetagent.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}.
 */
public class AgentConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("server")
    private ServerConfig server = new ServerConfig();

    @JsonProperty("auto-update")
    private AutoUpdateConfig autoUpdate = new AutoUpdateConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public ServerConfig getServer() {
        return server;
    }

    public AutoUpdateConfig getAutoUpdate() {
        return autoUpdate;
    }
}
