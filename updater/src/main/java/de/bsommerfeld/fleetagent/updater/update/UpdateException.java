package de.bsommerfeld.fleetagent.updater.update;

/**
 * Thrown when an update step fails. Carries the category reported in
 * telemetry and progress events.
 */
public class UpdateException extends Exception {

    private final UpdateErrorCode code;

    public UpdateException(UpdateErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public UpdateException(UpdateErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public UpdateErrorCode getCode() {
        return code;
    }
}
