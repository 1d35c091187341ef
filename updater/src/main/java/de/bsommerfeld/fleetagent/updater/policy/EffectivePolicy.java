package de.bsommerfeld.fleetagent.updater.policy;

import java.util.Optional;

/**
 * The policy the update manager actually honours.
 *
 * @param source        where the policy came from
 * @param spec          the governing spec, {@code null} when disabled
 * @param blockedReason why no version can currently be eligible, or
 *                      {@code null}
 */
public record EffectivePolicy(PolicySource source, PolicySpec spec, String blockedReason) {

    private static final EffectivePolicy DISABLED = new EffectivePolicy(PolicySource.DISABLED, null, null);

    public static EffectivePolicy disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return source != PolicySource.DISABLED;
    }

    public Optional<String> blocked() {
        return Optional.ofNullable(blockedReason);
    }
}
