package de.bsommerfeld.fleetagent.updater.validation;

import java.util.Optional;

/**
 * Checks that the freshly started agent works well enough to keep.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * @return a failure description, or empty when healthy
     */
    Optional<String> check();
}
