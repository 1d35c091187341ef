package de.bsommerfeld.fleetagent.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the agent's data directory following each platform's
 * conventions. Paths are returned but never created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code /Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %PROGRAMDATA%\{appName}} (fallback:
 * {@code C:\ProgramData})</li>
 * <li><strong>Linux</strong>: {@code /var/lib/{appName}} when writable by a
 * service account, otherwise {@code $XDG_DATA_HOME/{appName}}</li>
 * </ul>
 *
 * The {@code agent.data-dir} system property overrides all of the above.
 */
public final class StorageUtils {

    public static final String DATA_DIR_PROPERTY = "agent.data-dir";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String override = System.getProperty(DATA_DIR_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override).toAbsolutePath();
        }

        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get("/Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String programData = System.getenv("PROGRAMDATA");
            return Paths.get(programData != null ? programData : "C:\\ProgramData", appName);
        }

        Path system = Paths.get("/var", "lib", appName);
        if (system.toFile().canWrite()) {
            return system;
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share", appName);
    }

    /**
     * @return {@code {appDataDir}/logs}
     */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    /**
     * Working directory of the self-updater: rollback marker, failed-version
     * registry, downloads and binary backups.
     *
     * @return {@code {appDataDir}/autoupdate}
     */
    public static Path getAutoUpdateDir(String appName) {
        return getAppDataDir(appName).resolve("autoupdate");
    }
}
