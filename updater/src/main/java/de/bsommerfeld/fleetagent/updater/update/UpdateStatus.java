package de.bsommerfeld.fleetagent.updater.update;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of an update session. {@link #IDLE} means no session is live.
 */
public enum UpdateStatus {

    IDLE("idle"),
    CHECKING("checking"),
    UP_TO_DATE("up_to_date"),
    AVAILABLE("available"),
    DOWNLOADING("downloading"),
    VERIFYING("verifying"),
    INSTALLING("installing"),
    AWAITING_RESTART("awaiting_restart"),
    VALIDATING("validating"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back"),
    CANCELLED("cancelled");

    private static final Set<UpdateStatus> CANCELLABLE = EnumSet.of(CHECKING, DOWNLOADING, VERIFYING);
    private static final Set<UpdateStatus> TERMINAL = EnumSet.of(UP_TO_DATE, SUCCEEDED, FAILED, ROLLED_BACK,
            CANCELLED);

    private final String wireName;

    UpdateStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isCancellable() {
        return CANCELLABLE.contains(this);
    }

    /** Terminal statuses end a session; the manager returns to idle afterwards. */
    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Failed, rolled back and cancelled sessions report progress -1. */
    public boolean isUnsuccessful() {
        return this == FAILED || this == ROLLED_BACK || this == CANCELLED;
    }
}
