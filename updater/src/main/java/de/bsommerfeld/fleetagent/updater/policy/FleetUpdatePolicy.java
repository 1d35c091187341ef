package de.bsommerfeld.fleetagent.updater.policy;

import java.time.Instant;

/**
 * Policy pushed by the fleet server. Each arrival replaces the previous one.
 */
public record FleetUpdatePolicy(String tenantId, PolicySpec spec, Instant updatedAt) {

    public FleetUpdatePolicy {
        if (spec == null) {
            throw new IllegalArgumentException("Fleet policy requires a spec");
        }
        tenantId = tenantId == null ? "" : tenantId;
    }
}
