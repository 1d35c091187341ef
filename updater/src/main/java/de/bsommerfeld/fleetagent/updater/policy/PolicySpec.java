package de.bsommerfeld.fleetagent.updater.policy;

/**
 * One update policy as configured locally or issued by the fleet server.
 *
 * @param updateCheckDays    days between automatic checks; 0 disables them
 * @param versionPinStrategy how far an automatic update may move
 * @param allowMajorUpgrade  whether automatic updates may cross a major line
 * @param targetVersion      exact version for {@link VersionPinStrategy#PIN},
 *                           empty otherwise
 * @param collectTelemetry   whether update outcomes are reported
 * @param maintenanceWindow  when scheduled checks may run
 */
public record PolicySpec(int updateCheckDays, VersionPinStrategy versionPinStrategy, boolean allowMajorUpgrade,
        String targetVersion, boolean collectTelemetry, MaintenanceWindow maintenanceWindow) {

    public PolicySpec {
        updateCheckDays = Math.max(0, updateCheckDays);
        versionPinStrategy = versionPinStrategy == null ? VersionPinStrategy.MINOR : versionPinStrategy;
        targetVersion = targetVersion == null ? "" : targetVersion.trim();
        maintenanceWindow = maintenanceWindow == null ? MaintenanceWindow.DISABLED : maintenanceWindow;
    }

    public static PolicySpec defaults() {
        return new PolicySpec(7, VersionPinStrategy.MINOR, false, "", true, MaintenanceWindow.DISABLED);
    }

    public boolean automaticChecksEnabled() {
        return updateCheckDays > 0;
    }

    /** A pin without target can never be satisfied. */
    public boolean isUnsatisfiablePin() {
        return versionPinStrategy == VersionPinStrategy.PIN && targetVersion.isEmpty();
    }
}
