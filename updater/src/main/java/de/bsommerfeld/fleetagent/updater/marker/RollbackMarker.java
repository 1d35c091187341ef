package de.bsommerfeld.fleetagent.updater.marker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Written right before an install replaces the binary. Finding it on start
 * means the process runs after a self-initiated update and must validate it.
 */
public record RollbackMarker(
        @JsonProperty("previous_version") String previousVersion,
        @JsonProperty("expected_new_version") String expectedNewVersion,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("run_id") String runId,
        @JsonProperty("reason") String reason) {
}
