package de.bsommerfeld.fleetagent.updater.update;

/**
 * Auto-update is disabled by the local override mode.
 */
public class UpdateDisabledException extends UpdateException {

    public UpdateDisabledException(String message) {
        super(UpdateErrorCode.POLICY_DISABLED, message);
    }
}
