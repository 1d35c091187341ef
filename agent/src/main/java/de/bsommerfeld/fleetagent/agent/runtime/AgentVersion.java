package de.bsommerfeld.fleetagent.agent.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version of the running agent, stamped into {@code agent-version.properties}
 * at build time. The {@code agent.version} system property overrides it.
 */
public final class AgentVersion {

    private static final Logger LOG = LoggerFactory.getLogger(AgentVersion.class);

    public static final String PROPERTY = "agent.version";
    static final String RESOURCE = "/agent-version.properties";
    static final String FALLBACK = "0.0.0-dev";

    private AgentVersion() {
    }

    public static String current() {
        String override = System.getProperty(PROPERTY);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return fromResource(RESOURCE);
    }

    static String fromResource(String resource) {
        try (InputStream in = AgentVersion.class.getResourceAsStream(resource)) {
            if (in == null) {
                LOG.warn("{} not found, reporting version {}", resource, FALLBACK);
                return FALLBACK;
            }
            Properties props = new Properties();
            props.load(in);
            String version = props.getProperty("version", "").trim();
            // Unfiltered resource when running from an IDE
            if (version.isEmpty() || version.startsWith("${")) {
                return FALLBACK;
            }
            return version;
        } catch (IOException e) {
            LOG.warn("Failed to read {}: {}", resource, e.getMessage());
            return FALLBACK;
        }
    }
}
