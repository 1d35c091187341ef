package de.bsommerfeld.fleetagent.updater.policy;

/**
 * Where an {@link EffectivePolicy} came from.
 */
public enum PolicySource {

    FLEET("fleet"),
    LOCAL("local"),
    /** Inherit mode while no fleet policy is known; the local policy applies. */
    FALLBACK("fallback"),
    DISABLED("disabled");

    private final String wireName;

    PolicySource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
