package de.bsommerfeld.fleetagent.updater.telemetry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one update run as reported to the fleet server.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TelemetryPayload(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("run_id") String runId,
        @JsonProperty("status") String status,
        @JsonProperty("current_version") String currentVersion,
        @JsonProperty("target_version") String targetVersion,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("reason") String reason,
        @JsonProperty("timestamp") Instant timestamp) {
}
