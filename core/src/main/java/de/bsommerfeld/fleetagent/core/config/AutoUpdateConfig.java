package de.bsommerfeld.fleetagent.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class AutoUpdateConfig {

    // inherit | local | disabled
    @JsonProperty("mode")
    private String mode = "inherit";

    @JsonProperty("channel")
    private String channel = "stable";

    @JsonProperty("min-disk-space-mb")
    private long minDiskSpaceMb = 200;

    @JsonProperty("failed-version-cooldown-hours")
    private long failedVersionCooldownHours = 72;

    @JsonProperty("policy-recheck-minutes")
    private long policyRecheckMinutes = 60;

    @JsonProperty("shutdown-grace-seconds")
    private long shutdownGraceSeconds = 30;

    // Empty: the binary of the running process
    @JsonProperty("binary-path")
    private String binaryPath = "";

    // Empty: exit and let the service manager restart the agent
    @JsonProperty("restart-command")
    private List<String> restartCommand = new ArrayList<>();

    @JsonProperty("local-policy")
    private LocalPolicyConfig localPolicy = new LocalPolicyConfig();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public long getMinDiskSpaceMb() {
        return minDiskSpaceMb;
    }

    public void setMinDiskSpaceMb(long minDiskSpaceMb) {
        this.minDiskSpaceMb = minDiskSpaceMb;
    }

    public long getFailedVersionCooldownHours() {
        return failedVersionCooldownHours;
    }

    public void setFailedVersionCooldownHours(long failedVersionCooldownHours) {
        this.failedVersionCooldownHours = failedVersionCooldownHours;
    }

    public long getPolicyRecheckMinutes() {
        return policyRecheckMinutes;
    }

    public void setPolicyRecheckMinutes(long policyRecheckMinutes) {
        this.policyRecheckMinutes = policyRecheckMinutes;
    }

    public long getShutdownGraceSeconds() {
        return shutdownGraceSeconds;
    }

    public void setShutdownGraceSeconds(long shutdownGraceSeconds) {
        this.shutdownGraceSeconds = shutdownGraceSeconds;
    }

    public String getBinaryPath() {
        return binaryPath;
    }

    public void setBinaryPath(String binaryPath) {
        this.binaryPath = binaryPath;
    }

    public List<String> getRestartCommand() {
        return restartCommand;
    }

    public void setRestartCommand(List<String> restartCommand) {
        this.restartCommand = restartCommand;
    }

    public LocalPolicyConfig getLocalPolicy() {
        return localPolicy;
    }

    public void setLocalPolicy(LocalPolicyConfig localPolicy) {
        this.localPolicy = localPolicy;
    }
}
