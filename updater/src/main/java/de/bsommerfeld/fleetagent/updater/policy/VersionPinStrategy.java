package de.bsommerfeld.fleetagent.updater.policy;

import java.util.Locale;

/**
 * How far from the running version an automatic update may move.
 */
public enum VersionPinStrategy {

    LATEST("latest"),
    /** Stay within the running major line. */
    MINOR("minor"),
    /** Stay within the running major.minor line. */
    PATCH("patch"),
    /** Stay exactly at the policy's target version. */
    PIN("pin");

    private final String wireName;

    VersionPinStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a wire or config name, case-insensitively. {@code major} is an
     * older alias of {@code latest}.
     *
     * @throws PolicyParseException if the name is unknown
     */
    public static VersionPinStrategy parse(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("major")) {
            return LATEST;
        }
        for (VersionPinStrategy strategy : values()) {
            if (strategy.wireName.equals(value)) {
                return strategy;
            }
        }
        throw new PolicyParseException("Unrecognized version pin strategy: '" + raw + "'");
    }
}
