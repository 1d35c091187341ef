package de.bsommerfeld.fleetagent.updater.update;

/**
 * Machine-readable failure categories carried in telemetry.
 */
public enum UpdateErrorCode {

    SERVER_ERROR,
    DISK_SPACE,
    DOWNLOAD_FAILED,
    HASH_MISMATCH,
    INSTALL_FAILED,
    RESTART_FAILED,
    VERSION_MISMATCH,
    HEALTH_CHECK,
    ROLLED_BACK,
    MARKER_CORRUPT,
    POLICY_DISABLED,
    BUSY,
    CANCELLED,
    INTERNAL
}
