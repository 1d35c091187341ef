package de.bsommerfeld.fleetagent.agent.server;

import de.bsommerfeld.fleetagent.updater.telemetry.TelemetryPayload;
import de.bsommerfeld.fleetagent.updater.telemetry.TelemetrySink;

import java.io.IOException;

/**
 * Posts update outcomes to {@code /api/v1/agents/<id>/update-telemetry}.
 */
public class HttpTelemetrySink implements TelemetrySink {

    private final ServerConnection connection;

    public HttpTelemetrySink(ServerConnection connection) {
        this.connection = connection;
    }

    @Override
    public void report(TelemetryPayload payload) throws IOException {
        connection.postJson(connection.agentPath("/update-telemetry"), payload);
    }
}
