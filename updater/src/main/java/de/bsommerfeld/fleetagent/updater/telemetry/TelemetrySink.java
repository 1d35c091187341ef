package de.bsommerfeld.fleetagent.updater.telemetry;

import java.io.IOException;

/**
 * Delivers telemetry to the fleet server. May block.
 */
@FunctionalInterface
public interface TelemetrySink {

    void report(TelemetryPayload payload) throws IOException;
}
