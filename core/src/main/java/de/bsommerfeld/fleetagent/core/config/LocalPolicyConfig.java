package de.bsommerfeld.fleetagent.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Site-local update policy. Applies when the agent runs in {@code local}
 * mode, or in {@code inherit} mode while no fleet policy has arrived yet.
 */
public class LocalPolicyConfig {

    @JsonProperty("update-check-days")
    private int updateCheckDays = 7;

    // latest | minor | patch | pin
    @JsonProperty("version-pin-strategy")
    private String versionPinStrategy = "minor";

    @JsonProperty("allow-major-upgrade")
    private boolean allowMajorUpgrade = false;

    @JsonProperty("target-version")
    private String targetVersion = "";

    @JsonProperty("collect-telemetry")
    private boolean collectTelemetry = true;

    @JsonProperty("maintenance-window")
    private MaintenanceWindowConfig maintenanceWindow = new MaintenanceWindowConfig();

    public int getUpdateCheckDays() {
        return updateCheckDays;
    }

    public void setUpdateCheckDays(int updateCheckDays) {
        this.updateCheckDays = updateCheckDays;
    }

    public String getVersionPinStrategy() {
        return versionPinStrategy;
    }

    public void setVersionPinStrategy(String versionPinStrategy) {
        this.versionPinStrategy = versionPinStrategy;
    }

    public boolean isAllowMajorUpgrade() {
        return allowMajorUpgrade;
    }

    public void setAllowMajorUpgrade(boolean allowMajorUpgrade) {
        this.allowMajorUpgrade = allowMajorUpgrade;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public void setTargetVersion(String targetVersion) {
        this.targetVersion = targetVersion;
    }

    public boolean isCollectTelemetry() {
        return collectTelemetry;
    }

    public void setCollectTelemetry(boolean collectTelemetry) {
        this.collectTelemetry = collectTelemetry;
    }

    public MaintenanceWindowConfig getMaintenanceWindow() {
        return maintenanceWindow;
    }

    public void setMaintenanceWindow(MaintenanceWindowConfig maintenanceWindow) {
        this.maintenanceWindow = maintenanceWindow;
    }
}
