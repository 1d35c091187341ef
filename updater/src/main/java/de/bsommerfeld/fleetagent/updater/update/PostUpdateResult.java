package de.bsommerfeld.fleetagent.updater.update;

/**
 * Outcome of the post-restart validation.
 *
 * @param updated     whether this start followed a self-initiated update
 * @param status      {@link UpdateStatus#SUCCEEDED}, {@link UpdateStatus#FAILED},
 *                    {@link UpdateStatus#ROLLED_BACK}, or {@link UpdateStatus#IDLE}
 *                    when not updated
 * @param fromVersion version before the update, or empty
 * @param toVersion   version the update was meant to install, or empty
 * @param errorCode   failure category, or {@code null}
 * @param error       failure description, or empty
 */
public record PostUpdateResult(boolean updated, UpdateStatus status, String fromVersion, String toVersion,
        UpdateErrorCode errorCode, String error) {

    public static PostUpdateResult notUpdated() {
        return new PostUpdateResult(false, UpdateStatus.IDLE, "", "", null, "");
    }

    public static PostUpdateResult succeeded(String from, String to) {
        return new PostUpdateResult(true, UpdateStatus.SUCCEEDED, from, to, null, "");
    }

    public static PostUpdateResult failed(UpdateStatus status, String from, String to, UpdateErrorCode code,
            String error) {
        return new PostUpdateResult(true, status, from, to, code, error);
    }

    public boolean isSuccess() {
        return status == UpdateStatus.SUCCEEDED;
    }
}
