package de.bsommerfeld.fleetagent.updater.policy;

import java.util.Locale;

/**
 * Site administrator's override of fleet-wide update governance.
 */
public enum AgentOverrideMode {

    /** Fleet policy governs; local policy is the fallback until one arrives. */
    INHERIT("inherit"),
    /** Local policy governs; fleet policy is ignored. */
    LOCAL("local"),
    /** Automatic and forced updates are disabled. */
    NEVER("disabled");

    private final String wireName;

    AgentOverrideMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a configured mode. Accepts {@code inherit}, {@code fleet},
     * {@code auto} or blank for {@link #INHERIT}, {@code local}, and
     * {@code disabled}, {@code never} or {@code off} for {@link #NEVER}.
     *
     * @throws PolicyParseException for any other value
     */
    public static AgentOverrideMode parse(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "", "inherit", "fleet", "auto":
                return INHERIT;
            case "local":
                return LOCAL;
            case "disabled", "never", "off":
                return NEVER;
            default:
                throw new PolicyParseException("Unrecognized auto-update mode: '" + raw + "'");
        }
    }
}
