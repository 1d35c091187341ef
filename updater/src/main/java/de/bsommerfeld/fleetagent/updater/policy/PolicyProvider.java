package de.bsommerfeld.fleetagent.updater.policy;

import java.util.Optional;

/**
 * Supplies the inputs of {@link PolicyResolver}. Implementations must be
 * safe to call from any thread and return immutable snapshots.
 */
public interface PolicyProvider {

    AgentOverrideMode overrideMode();

    PolicySpec localPolicy();

    Optional<FleetUpdatePolicy> fleetPolicy();

    default EffectivePolicy effectivePolicy() {
        return PolicyResolver.resolve(overrideMode(), localPolicy(), fleetPolicy().orElse(null));
    }
}
