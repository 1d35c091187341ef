package de.bsommerfeld.fleetagent.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the agent.
 * In {@link #TEST} mode the agent never talks to the fleet server for
 * releases and never replaces its own binary.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code app.mode} system property, then the
     * {@code APP_MODE} environment variable. Defaults to PROD.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("APP_MODE");
        }
        return from(mode);
    }

    /**
     * Parses a raw mode name. Blank and unknown names resolve to PROD.
     */
    public static ApplicationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PROD;
        }
        try {
            return ApplicationMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown Application Mode '{}'. Defaulting to PROD.", raw);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
