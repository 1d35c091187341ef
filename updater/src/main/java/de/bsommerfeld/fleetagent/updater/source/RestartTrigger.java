package de.bsommerfeld.fleetagent.updater.source;

import de.bsommerfeld.fleetagent.updater.update.UpdateException;

/**
 * Restarts the agent so an installed update takes effect. Usually does not
 * return on success.
 */
@FunctionalInterface
public interface RestartTrigger {

    /**
     * @return true if the process is going down to restart, false if no
     *         restart takes place and the agent keeps running as it is
     */
    boolean restart() throws UpdateException;
}
