package de.bsommerfeld.fleetagent.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection settings for the fleet server.
 */
public class ServerConfig {

    @JsonProperty("url")
    private String url = "http://localhost:9090";

    @JsonProperty("agent-id")
    private String agentId = "";

    @JsonProperty("timeout-seconds")
    private int timeoutSeconds = 30;

    @JsonProperty("command-poll-seconds")
    private int commandPollSeconds = 30;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getCommandPollSeconds() {
        return commandPollSeconds;
    }

    public void setCommandPollSeconds(int commandPollSeconds) {
        this.commandPollSeconds = commandPollSeconds;
    }
}
