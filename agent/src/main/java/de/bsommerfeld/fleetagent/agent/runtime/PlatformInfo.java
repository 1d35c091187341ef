package de.bsommerfeld.fleetagent.agent.runtime;

import java.util.Locale;

/**
 * Operating system and CPU architecture in the names release manifests use.
 */
public final class PlatformInfo {

    private PlatformInfo() {
    }

    public static String os() {
        return normalizeOs(System.getProperty("os.name", ""));
    }

    public static String arch() {
        return normalizeArch(System.getProperty("os.arch", ""));
    }

    static String normalizeOs(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.contains("win")) return "windows";
        if (name.contains("mac") || name.contains("darwin")) return "darwin";
        if (name.contains("linux")) return "linux";
        if (name.contains("freebsd")) return "freebsd";
        return name.isBlank() ? "unknown" : name.replace(' ', '_');
    }

    static String normalizeArch(String osArch) {
        String arch = osArch.toLowerCase(Locale.ROOT);
        switch (arch) {
            case "amd64", "x86_64", "x64":
                return "amd64";
            case "aarch64", "arm64":
                return "arm64";
            case "x86", "i386", "i686":
                return "386";
            default:
                return arch.isBlank() ? "unknown" : arch;
        }
    }
}
