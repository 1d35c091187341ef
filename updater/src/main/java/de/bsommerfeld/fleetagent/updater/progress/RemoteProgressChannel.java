package de.bsommerfeld.fleetagent.updater.progress;

import java.io.IOException;

/**
 * Transport towards the fleet server. May block; only ever called from the
 * forwarder thread.
 */
@FunctionalInterface
public interface RemoteProgressChannel {

    void send(ProgressEvent event) throws IOException;
}
