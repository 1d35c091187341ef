package de.bsommerfeld.fleetagent.updater.version;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code major.minor.patch[-prerelease]} with SemVer precedence.
 *
 * <p>
 * Parsing tolerates a leading {@code v}, drops {@code +build} metadata and
 * folds a fourth numeric segment ({@code 1.2.3.4}) into the pre-release tag
 * so Windows-style file versions still compare.
 */
public record SemanticVersion(int major, int minor, int patch, String preRelease)
        implements Comparable<SemanticVersion> {

    private static final Pattern SEMVER_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)(?:-([0-9A-Za-z.-]+))?$");
    private static final Pattern EXTENDED_CORE = Pattern.compile("^(\\d+\\.\\d+\\.\\d+)\\.([0-9.]+)$");

    public static Optional<SemanticVersion> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(raw);
        int plus = normalized.indexOf('+');
        if (plus >= 0) {
            normalized = normalized.substring(0, plus);
        }

        String core = normalized;
        String preRelease = null;
        int dash = normalized.indexOf('-');
        if (dash >= 0) {
            core = normalized.substring(0, dash);
            preRelease = normalized.substring(dash + 1);
        }
        Matcher extended = EXTENDED_CORE.matcher(core);
        if (extended.matches()) {
            String extra = extended.group(2);
            preRelease = preRelease == null ? extra : extra + "." + preRelease;
            normalized = extended.group(1) + "-" + preRelease;
        }

        Matcher matcher = SEMVER_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SemanticVersion(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    matcher.group(4)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Trims whitespace and a leading {@code v}/{@code V}. */
    public static String normalize(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        if (trimmed.startsWith("v") || trimmed.startsWith("V")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed;
    }

    public boolean isNewerThan(SemanticVersion other) {
        return compareTo(other) > 0;
    }

    public boolean sameMajor(SemanticVersion other) {
        return major == other.major;
    }

    public boolean sameMinorLine(SemanticVersion other) {
        return major == other.major && minor == other.minor;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        if (patch != other.patch) {
            return Integer.compare(patch, other.patch);
        }
        if (preRelease == null && other.preRelease == null) {
            return 0;
        }
        // A release outranks any of its pre-releases
        if (preRelease == null) {
            return 1;
        }
        if (other.preRelease == null) {
            return -1;
        }
        return comparePreRelease(preRelease, other.preRelease);
    }

    private static int comparePreRelease(String left, String right) {
        String[] leftParts = left.split("\\.");
        String[] rightParts = right.split("\\.");
        int max = Math.max(leftParts.length, rightParts.length);

        for (int i = 0; i < max; i++) {
            if (i >= leftParts.length) {
                return -1;
            }
            if (i >= rightParts.length) {
                return 1;
            }
            String leftPart = leftParts[i];
            String rightPart = rightParts[i];
            boolean leftNumeric = leftPart.matches("\\d+");
            boolean rightNumeric = rightPart.matches("\\d+");

            if (leftNumeric && rightNumeric) {
                int cmp = Long.compare(Long.parseLong(leftPart), Long.parseLong(rightPart));
                if (cmp != 0) {
                    return cmp;
                }
                continue;
            }
            if (leftNumeric) {
                return -1;
            }
            if (rightNumeric) {
                return 1;
            }
            int cmp = leftPart.compareTo(rightPart);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @Override
    public String toString() {
        String core = major + "." + minor + "." + patch;
        return preRelease == null ? core : core + "-" + preRelease;
    }
}
