package de.bsommerfeld.fleetagent.updater.util;

import java.util.Locale;

/**
 * Human-readable byte sizes for log and progress messages.
 */
public final class ByteFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteFormatter() {}

    /**
     * @return e.g. {@code "14.3 MB"}, or {@code "? B"} for unknown sizes
     */
    public static String format(long bytes) {
        if (bytes < 0) return "? B";

        double value = bytes;
        int unitIdx = 0;
        while (value >= 1024 && unitIdx < UNITS.length - 1) {
            value /= 1024;
            unitIdx++;
        }

        if (unitIdx == 0) return bytes + " B";
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unitIdx]);
    }

    public static long megabytes(long mb) {
        return mb * 1024L * 1024L;
    }
}
