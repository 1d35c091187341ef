package de.bsommerfeld.fleetagent.updater.update;

/**
 * A session is already live; the request was not started.
 */
public class UpdateBusyException extends UpdateException {

    public UpdateBusyException(UpdateStatus liveStatus) {
        super(UpdateErrorCode.BUSY, "Update already in progress (" + liveStatus.wireName() + ")");
    }
}
