package de.bsommerfeld.fleetagent.updater.policy;

/**
 * Merges the override mode, the local policy and the optional fleet policy
 * into one {@link EffectivePolicy}. Pure and total: the same inputs always
 * give the same result and nothing is thrown, logged or stored.
 */
public final class PolicyResolver {

    static final String UNSATISFIABLE_PIN = "Pin strategy without target version";

    private PolicyResolver() {
    }

    /**
     * @param fleet the last fleet policy, or {@code null} if none arrived
     */
    public static EffectivePolicy resolve(AgentOverrideMode mode, PolicySpec local, FleetUpdatePolicy fleet) {
        if (mode == AgentOverrideMode.NEVER) {
            return EffectivePolicy.disabled();
        }
        PolicySpec localSpec = local == null ? PolicySpec.defaults() : local;

        PolicySource source;
        PolicySpec spec;
        if (mode == AgentOverrideMode.LOCAL) {
            source = PolicySource.LOCAL;
            spec = localSpec;
        } else if (fleet != null) {
            source = PolicySource.FLEET;
            spec = fleet.spec();
        } else {
            source = PolicySource.FALLBACK;
            spec = localSpec;
        }

        String blocked = spec.isUnsatisfiablePin() ? UNSATISFIABLE_PIN : null;
        return new EffectivePolicy(source, spec, blocked);
    }
}
